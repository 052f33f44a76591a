package io.kifmt.parser.impl;

import io.kifmt.parser.api.CancellationToken;
import io.kifmt.parser.api.DocumentKind;
import io.kifmt.parser.api.FormatOptions;
import io.kifmt.parser.api.KiCadDocument;
import io.kifmt.parser.api.KiCadFileException;
import io.kifmt.parser.api.KiCadFormat;
import io.kifmt.parser.internal_api.ElementFormatException;
import io.kifmt.parser.internal_api.ReadContext;
import io.kifmt.sexpr.Node;
import io.kifmt.sexpr.SExpressionFormatException;
import io.kifmt.sexpr.SExpressionParser;
import io.kifmt.sexpr.SExpressionWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link KiCadFormat}: text I/O around a {@link DocumentReader} and a {@link
 * DocumentWriter}.
 *
 * @param <D> the document type
 */
public final class KiCadFormatImpl<D extends KiCadDocument> implements KiCadFormat<D> {
  private static final Logger log = LoggerFactory.getLogger(KiCadFormatImpl.class);

  static final int CHUNK_SIZE = 64 * 1024;

  private final DocumentKind kind;
  private final DocumentReader<D> reader;
  private final DocumentWriter<D> writer;
  private final FormatOptions options;
  private final SExpressionWriter treeWriter;

  public KiCadFormatImpl(
      DocumentKind kind, DocumentReader<D> reader, DocumentWriter<D> writer, FormatOptions options) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.reader = Objects.requireNonNull(reader, "reader");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.options = Objects.requireNonNull(options, "options");
    this.treeWriter = options.newWriter();
  }

  @Override
  public DocumentKind kind() {
    return kind;
  }

  @Override
  public FormatOptions options() {
    return options;
  }

  @Override
  public D read(Path path) throws KiCadFileException {
    return read(path, CancellationToken.none());
  }

  @Override
  public D read(Path path, CancellationToken token) throws KiCadFileException {
    String source = path.toString();
    token.throwIfCancelled(source);
    String text;
    try (InputStream in = Files.newInputStream(path)) {
      text = readText(in, source, token);
    } catch (IOException e) {
      throw KiCadFileException.io(source, e);
    }
    return parse(text, source);
  }

  @Override
  public D read(InputStream in) throws KiCadFileException {
    return read(in, CancellationToken.none());
  }

  @Override
  public D read(InputStream in, CancellationToken token) throws KiCadFileException {
    String source = "<stream>";
    token.throwIfCancelled(source);
    String text;
    try {
      text = readText(in, source, token);
    } catch (IOException e) {
      throw KiCadFileException.io(source, e);
    }
    return parse(text, source);
  }

  private static String readText(InputStream in, String source, CancellationToken token)
      throws IOException, KiCadFileException {
    Reader r = new InputStreamReader(in, StandardCharsets.UTF_8);
    StringBuilder sb = new StringBuilder();
    char[] buffer = new char[CHUNK_SIZE];
    int n;
    while ((n = r.read(buffer)) != -1) {
      sb.append(buffer, 0, n);
      token.throwIfCancelled(source);
    }
    return sb.toString();
  }

  @Override
  public D parse(CharSequence text) throws KiCadFileException {
    return parse(text, "<text>");
  }

  private D parse(CharSequence text, String source) throws KiCadFileException {
    Node root;
    try {
      root = SExpressionParser.parse(text);
    } catch (SExpressionFormatException e) {
      throw KiCadFileException.syntax(source, e);
    }
    D document = fromTree(root, source);
    log.debug(
        "Read {} from {}: {} diagnostic(s)", kind, source, document.getDiagnostics().size());
    return document;
  }

  @Override
  public D fromTree(Node root) throws KiCadFileException {
    return fromTree(root, "<tree>");
  }

  private D fromTree(Node root, String source) throws KiCadFileException {
    ReadContext ctx = new ReadContext(options, source);
    D document;
    try {
      document = reader.read(root, ctx);
    } catch (ElementFormatException e) {
      // Children are isolated by the dispatcher; only the root node itself gets here.
      throw KiCadFileException.malformedRoot(source, e);
    }
    document.getDiagnostics().addAll(ctx.diagnostics());
    if (options.retainSourceTree()) {
      document.setSourceTree(root);
    }
    return document;
  }

  @Override
  public Node toTree(D document) {
    return writer.write(document);
  }

  @Override
  public void write(D document, OutputStream out) throws KiCadFileException {
    write(document, out, CancellationToken.none());
  }

  @Override
  public void write(D document, OutputStream out, CancellationToken token)
      throws KiCadFileException {
    write(document, out, "<stream>", token);
  }

  private void write(D document, OutputStream out, String source, CancellationToken token)
      throws KiCadFileException {
    String text = writeToString(document);
    token.throwIfCancelled(source);
    try {
      Writer w = new OutputStreamWriter(out, StandardCharsets.UTF_8);
      w.write(text);
      token.throwIfCancelled(source);
      w.flush();
    } catch (IOException e) {
      throw KiCadFileException.io(source, e);
    }
  }

  @Override
  public void write(D document, Path path) throws KiCadFileException {
    String source = path.toString();
    try (OutputStream out = Files.newOutputStream(path)) {
      write(document, out, source, CancellationToken.none());
    } catch (IOException e) {
      throw KiCadFileException.io(source, e);
    }
  }

  @Override
  public String writeToString(D document) {
    return treeWriter.write(toTree(document)) + "\n";
  }
}
