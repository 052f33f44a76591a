package io.kifmt.sexpr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns S-expression text into a {@link Node} tree.
 *
 * <p>The parser has no knowledge of KiCad semantics. It is a pure function: it keeps no state
 * between calls and can be used concurrently from any number of threads. Nesting is handled with
 * an explicit stack, so deeply nested input cannot overflow the call stack.
 *
 * <p>Recognized lexical forms:
 *
 * <ul>
 *   <li>{@code (} token ... {@code )} groups
 *   <li>double-quoted strings with {@code \n \r \t \\ \"} escapes; any other escaped character is
 *       taken literally
 *   <li>numbers: optional sign, digits with an optional fraction, optional exponent
 *   <li>symbols: any other run of characters up to whitespace, a parenthesis or a quote
 * </ul>
 */
public final class SExpressionParser {
  private SExpressionParser() {}

  /**
   * Parses exactly one root form from the given text.
   *
   * @param text the text to parse
   * @return the root node
   * @throws SExpressionFormatException if the text is not a single well-formed S-expression
   */
  public static Node parse(CharSequence text) throws SExpressionFormatException {
    return new Scanner(text).parseRoot();
  }

  /**
   * Checks whether a bare word is a numeric literal.
   *
   * @param word the word to check
   * @return {@code true} if the word is read as a number
   */
  public static boolean isNumeric(CharSequence word) {
    int len = word.length();
    int i = 0;
    if (i < len && (word.charAt(i) == '+' || word.charAt(i) == '-')) {
      i++;
    }
    int digits = 0;
    while (i < len && isDigit(word.charAt(i))) {
      i++;
      digits++;
    }
    if (i < len && word.charAt(i) == '.') {
      i++;
      while (i < len && isDigit(word.charAt(i))) {
        i++;
        digits++;
      }
    }
    if (digits == 0) {
      return false;
    }
    if (i < len && (word.charAt(i) == 'e' || word.charAt(i) == 'E')) {
      i++;
      if (i < len && (word.charAt(i) == '+' || word.charAt(i) == '-')) {
        i++;
      }
      int expDigits = 0;
      while (i < len && isDigit(word.charAt(i))) {
        i++;
        expDigits++;
      }
      if (expDigits == 0) {
        return false;
      }
    }
    return i == len;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isDelimiter(char c) {
    return c == '(' || c == ')' || c == '"' || Character.isWhitespace(c);
  }

  /** In-progress group on the parse stack. */
  private static final class Frame {
    final String token;
    final List<ScalarValue> values = new ArrayList<>();
    final List<Node> children = new ArrayList<>();

    Frame(String token) {
      this.token = token;
    }

    Node toNode() {
      return Node.of(token, values, children);
    }
  }

  private static final class Scanner {
    private final CharSequence text;
    private final int length;
    private int pos;

    Scanner(CharSequence text) {
      this.text = text;
      this.length = text.length();
      // a leading byte order mark is not content
      if (length > 0 && text.charAt(0) == '\uFEFF') {
        pos = 1;
      }
    }

    Node parseRoot() throws SExpressionFormatException {
      skipWhitespace();
      if (pos >= length) {
        throw error("Empty input, expected '('", pos);
      }
      if (text.charAt(pos) != '(') {
        throw error("Expected '(' at start of S-expression", pos);
      }
      Node root = parseGroup();
      skipWhitespace();
      if (pos < length) {
        throw error("Unexpected content after root S-expression", pos);
      }
      return root;
    }

    private Node parseGroup() throws SExpressionFormatException {
      Deque<Frame> stack = new ArrayDeque<>();
      Deque<Integer> openOffsets = new ArrayDeque<>();
      openOffsets.push(pos);
      pos++;
      stack.push(new Frame(readToken()));

      while (true) {
        skipWhitespace();
        if (pos >= length) {
          throw error("Unexpected end of input, missing ')' for group opened", openOffsets.peek());
        }
        char c = text.charAt(pos);
        if (c == ')') {
          pos++;
          openOffsets.pop();
          Node done = stack.pop().toNode();
          if (stack.isEmpty()) {
            return done;
          }
          stack.peek().children.add(done);
        } else if (c == '(') {
          openOffsets.push(pos);
          pos++;
          stack.push(new Frame(readToken()));
        } else if (c == '"') {
          stack.peek().values.add(new StringValue(readString()));
        } else {
          stack.peek().values.add(readAtom());
        }
      }
    }

    private String readToken() throws SExpressionFormatException {
      skipWhitespace();
      int start = pos;
      while (pos < length && !isDelimiter(text.charAt(pos))) {
        pos++;
      }
      if (pos == start) {
        throw error("Expected token after '('", pos);
      }
      return text.subSequence(start, pos).toString();
    }

    private ScalarValue readAtom() {
      int start = pos;
      while (pos < length && !isDelimiter(text.charAt(pos))) {
        pos++;
      }
      String word = text.subSequence(start, pos).toString();
      if (isNumeric(word)) {
        double d = Double.parseDouble(word);
        // out-of-range literals stay symbols so the text survives
        if (!Double.isInfinite(d)) {
          return new NumberValue(d, word);
        }
      }
      return new SymbolValue(word);
    }

    private String readString() throws SExpressionFormatException {
      int start = pos;
      pos++;
      StringBuilder sb = new StringBuilder();
      while (pos < length) {
        char c = text.charAt(pos);
        if (c == '\\') {
          pos++;
          if (pos >= length) {
            throw error("Unexpected end of input in escape sequence", pos);
          }
          char escaped = text.charAt(pos);
          switch (escaped) {
            case 'n' -> sb.append('\n');
            case 'r' -> sb.append('\r');
            case 't' -> sb.append('\t');
            default -> sb.append(escaped);
          }
          pos++;
        } else if (c == '"') {
          pos++;
          return sb.toString();
        } else {
          sb.append(c);
          pos++;
        }
      }
      throw error("Unterminated string literal", start);
    }

    private void skipWhitespace() {
      while (pos < length && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    private SExpressionFormatException error(String message, int offset) {
      int l = 1;
      int ls = 0;
      for (int i = 0; i < offset && i < length; i++) {
        if (text.charAt(i) == '\n') {
          l++;
          ls = i + 1;
        }
      }
      return new SExpressionFormatException(message, offset, l, offset - ls + 1);
    }
  }
}
