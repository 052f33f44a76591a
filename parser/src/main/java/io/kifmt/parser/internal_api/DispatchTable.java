package io.kifmt.parser.internal_api;

import io.kifmt.parser.api.model.Element;
import io.kifmt.sexpr.Node;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes the children of a container node to element readers by token.
 *
 * <p>Each routed child is read in isolation. When its reader throws, the child is dropped, an
 * error diagnostic naming it is recorded, and reading continues with the next sibling. Tables are
 * built once and are safe to share between threads once built.
 *
 * <pre>{@code
 * static final DispatchTable<Footprint> TABLE =
 *     new DispatchTable<Footprint>()
 *         .on("pad", PadReader::read, (fp, pad) -> fp.getPads().add(pad))
 *         .raw("group", "dimension");
 * }</pre>
 *
 * @param <P> the container entity
 */
public final class DispatchTable<P> {
  private static final Logger log = LoggerFactory.getLogger(DispatchTable.class);

  private final Map<String, Route<P, ?>> routes = new HashMap<>();
  private final Set<String> rawTokens = new HashSet<>();

  /**
   * Routes a token to a reader.
   *
   * @param token the child token
   * @param parser reads the child
   * @param sink stores the result on the container
   * @return this table
   */
  public <T> DispatchTable<P> on(
      String token, ElementParser<? extends T> parser, BiConsumer<? super P, ? super T> sink) {
    routes.put(token, new Route<>(parser, sink));
    return this;
  }

  /** Routes several tokens to the same reader. */
  public <T> DispatchTable<P> on(
      Set<String> tokens, ElementParser<? extends T> parser, BiConsumer<? super P, ? super T> sink) {
    for (String token : tokens) {
      on(token, parser, sink);
    }
    return this;
  }

  /** Declares tokens that are kept verbatim without a warning. */
  public DispatchTable<P> raw(String... tokens) {
    Collections.addAll(rawTokens, tokens);
    return this;
  }

  public Set<String> rawTokens() {
    return Collections.unmodifiableSet(rawTokens);
  }

  public boolean routes(String token) {
    return routes.containsKey(token);
  }

  /**
   * Reads every unused child with a routed token into the container.
   *
   * @param cursor the cursor over the container node
   * @param container the container entity
   */
  public void dispatch(NodeCursor cursor, P container) {
    ReadContext ctx = cursor.context();
    for (int i = 0; i < cursor.childCount(); i++) {
      if (cursor.isUsed(i)) {
        continue;
      }
      Node child = cursor.childAt(i);
      Route<P, ?> route = routes.get(child.token());
      if (route == null) {
        continue;
      }
      cursor.use(i);
      String label = describe(child);
      ctx.enter(label);
      try {
        route.apply(child, container, ctx);
      } catch (RuntimeException e) {
        ctx.error("Failed to read " + label + ": " + e.getMessage());
        log.debug("Dropped {} at {}", label, ctx.location(), e);
      } finally {
        ctx.exit();
      }
    }
  }

  /** Finishes the container with this table's raw tokens. */
  public void finish(NodeCursor cursor, Element container) {
    cursor.finish(container, rawTokens);
  }

  /**
   * Describes a node for diagnostics: its token and, when there is one, its first value or its
   * identifier.
   */
  public static String describe(Node node) {
    if (node.valueCount() > 0) {
      String text = node.text(0).get();
      return node.isQuoted(0) ? node.token() + " \"" + text + "\"" : node.token() + " " + text;
    }
    for (Node c : node.children()) {
      if (("uuid".equals(c.token()) || "tstamp".equals(c.token())) && c.valueCount() == 1) {
        return node.token() + " " + c.text(0).get();
      }
    }
    return node.token();
  }

  private static final class Route<P, T> {
    private final ElementParser<? extends T> parser;
    private final BiConsumer<? super P, ? super T> sink;

    Route(ElementParser<? extends T> parser, BiConsumer<? super P, ? super T> sink) {
      this.parser = parser;
      this.sink = sink;
    }

    void apply(Node node, P container, ReadContext ctx) {
      sink.accept(container, parser.parse(node, ctx));
    }
  }
}
