package io.kifmt.parser.impl;

import io.kifmt.parser.api.DocumentKind;
import io.kifmt.parser.api.KiCadDocument;
import io.kifmt.parser.api.KiCadFileException;
import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.model.Paper;
import io.kifmt.parser.api.model.TitleBlock;
import io.kifmt.parser.internal_api.Encoders;
import io.kifmt.parser.internal_api.NodeCursor;
import io.kifmt.parser.internal_api.ReadContext;
import io.kifmt.sexpr.Node;
import io.kifmt.sexpr.StringValue;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Document-level nodes shared by all kinds: root check, version header, paper, title block. */
public final class Headers {
  private static final Logger log = LoggerFactory.getLogger(Headers.class);

  private Headers() {}

  /**
   * Checks the root token.
   *
   * @throws KiCadFileException if the root does not belong to the kind
   */
  public static void checkRoot(Node root, DocumentKind kind, ReadContext ctx)
      throws KiCadFileException {
    if (!kind.acceptsRoot(root.token())) {
      throw KiCadFileException.wrongRoot(ctx.source(), kind.rootTokens(), root.token());
    }
  }

  /**
   * Reads {@code version}, {@code generator} and {@code generator_version}, and warns when the
   * version is newer than the reader knows.
   *
   * @param c the cursor over the root node
   * @param doc the document
   * @param maxVersion the newest format version the reader was written for
   */
  public static void read(NodeCursor c, KiCadDocument doc, int maxVersion) {
    c.childInt("version").ifPresent(doc::setVersion);
    c.childIf("generator", n -> n.valueCount() == 1 && n.childCount() == 0)
        .ifPresent(
            n -> {
              doc.setGenerator(n.text(0).get());
              doc.setGeneratorIsSymbol(!n.isQuoted(0));
            });
    c.childText("generator_version").ifPresent(doc::setGeneratorVersion);
    Integer version = doc.getVersion();
    if (version != null && version > maxVersion) {
      c.context()
          .warn(
              "File format version "
                  + version
                  + " is newer than supported version "
                  + maxVersion
                  + "; unknown content is kept verbatim");
      log.warn("Reading {} version {} with a reader for version {}", c.token(), version, maxVersion);
    }
  }

  /** Writes the version header in the spelling it was read with. */
  public static void write(Node.Builder b, KiCadDocument doc) {
    Encoders.putInt(b, "version", doc.getVersion());
    if (doc.getGenerator() != null) {
      b.child(
          Node.builder("generator")
              .value(
                  doc.isGeneratorIsSymbol()
                      ? Encoders.word(doc.getGenerator())
                      : new StringValue(doc.getGenerator()))
              .build());
    }
    Encoders.putText(b, doc, "generator_version", doc.getGeneratorVersion());
  }

  /** Reads {@code (paper "A4" [portrait])} or {@code (paper "User" w h)}. */
  public static Optional<Paper> paper(NodeCursor parent) {
    return parent.child("paper").map(n -> paper(n, parent.context()));
  }

  private static Paper paper(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Paper paper = new Paper(c.requireText(0, "paper size"));
    if (Paper.USER.equals(paper.getSize())) {
      c.number(1).ifPresent(w -> paper.setWidth(Coord.fromMm(w)));
      c.number(2).ifPresent(h -> paper.setHeight(Coord.fromMm(h)));
    }
    paper.setPortrait(c.takeSymbol("portrait"));
    c.finish(paper);
    return paper;
  }

  public static Node paper(Paper paper) {
    Node.Builder b = Node.builder("paper").value(Encoders.text(paper, "@0", paper.getSize()));
    if (paper.getWidth() != null && paper.getHeight() != null) {
      b.value(Encoders.mm(paper.getWidth())).value(Encoders.mm(paper.getHeight()));
    }
    if (paper.isPortrait()) {
      b.symbol("portrait");
    }
    return Encoders.finish(b, paper);
  }

  public static Optional<TitleBlock> titleBlock(NodeCursor parent) {
    return parent.child("title_block").map(n -> titleBlock(n, parent.context()));
  }

  private static TitleBlock titleBlock(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    TitleBlock tb = new TitleBlock();
    c.childText("title").ifPresent(tb::setTitle);
    c.childText("date").ifPresent(tb::setDate);
    c.childText("rev").ifPresent(tb::setRevision);
    c.childText("company").ifPresent(tb::setCompany);
    Set<Integer> numbers = new HashSet<>();
    for (int i = 0; i < c.childCount(); i++) {
      Node n = c.childAt(i);
      if (c.isUsed(i) || !n.token().equals("comment")) {
        continue;
      }
      if (!isComment(n)) {
        ctx.warn("Unsupported form of 'comment' in title_block kept verbatim");
        continue;
      }
      int number = n.integer(0).getAsInt();
      if (!numbers.add(number)) {
        ctx.warn("Duplicate comment " + number + " in title_block kept verbatim");
        continue;
      }
      c.use(i);
      if (!n.isQuoted(1)) {
        c.markBare("comment");
      }
      tb.getComments().add(new TitleBlock.Comment(number, n.text(1).get()));
    }
    c.finish(tb, Set.of("comment"));
    return tb;
  }

  private static boolean isComment(Node n) {
    return n.valueCount() == 2
        && n.childCount() == 0
        && n.number(0).isPresent()
        && n.number(0).getAsDouble() % 1 == 0;
  }

  public static Node titleBlock(TitleBlock tb) {
    Node.Builder b = Node.builder("title_block");
    Encoders.putText(b, tb, "title", tb.getTitle());
    Encoders.putText(b, tb, "date", tb.getDate());
    Encoders.putText(b, tb, "rev", tb.getRevision());
    Encoders.putText(b, tb, "company", tb.getCompany());
    for (TitleBlock.Comment comment : tb.getComments()) {
      b.child(
          Node.builder("comment")
              .integer(comment.number())
              .value(Encoders.text(tb, "comment", comment.text()))
              .build());
    }
    return Encoders.finish(b, tb);
  }
}
