package io.kifmt.parser.internal_api;

import io.kifmt.parser.api.Diagnostic;
import io.kifmt.parser.api.FormatOptions;
import java.util.ArrayList;
import java.util.List;

/**
 * State of one document read: the options, the diagnostics found so far and the path to the
 * element being read, used as diagnostic context.
 *
 * <p>Not thread-safe; each read creates its own context.
 */
public final class ReadContext {
  static final String TREE_SOURCE = "<tree>";

  private final FormatOptions options;
  private final String source;
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private final List<String> path = new ArrayList<>();

  public ReadContext(FormatOptions options) {
    this(options, TREE_SOURCE);
  }

  /**
   * @param options the read options
   * @param source the path or stream being read, used in exceptions
   */
  public ReadContext(FormatOptions options, String source) {
    this.options = options;
    this.source = source;
  }

  public FormatOptions options() {
    return options;
  }

  public String source() {
    return source;
  }

  public void warn(String message) {
    diagnostics.add(Diagnostic.warning(message, location()));
  }

  public void error(String message) {
    diagnostics.add(Diagnostic.error(message, location()));
  }

  public List<Diagnostic> diagnostics() {
    return diagnostics;
  }

  /** Enters a nested element; pair with {@link #exit()}. */
  public void enter(String segment) {
    path.add(segment);
  }

  public void exit() {
    path.remove(path.size() - 1);
  }

  /** @return the current element path, outermost first, such as {@code footprint "R1" > pad "2"} */
  public String location() {
    return String.join(" > ", path);
  }
}
