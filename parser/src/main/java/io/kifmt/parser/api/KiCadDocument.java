package io.kifmt.parser.api;

import io.kifmt.parser.api.model.Element;
import io.kifmt.sexpr.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Root of a document: the header fields every KiCad file shares and the diagnostics collected
 * while reading it.
 */
public abstract class KiCadDocument extends Element {
  private Integer version;
  private String generator;
  private boolean generatorIsSymbol;
  private String generatorVersion;
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private Node sourceTree;

  public abstract DocumentKind kind();

  /** @return the {@code (version yyyymmdd)} format version; null if absent */
  public Integer getVersion() {
    return version;
  }

  public void setVersion(Integer version) {
    this.version = version;
  }

  public String getGenerator() {
    return generator;
  }

  public void setGenerator(String generator) {
    this.generator = generator;
  }

  /** @return whether the generator was written bare, {@code (generator pcbnew)} */
  public boolean isGeneratorIsSymbol() {
    return generatorIsSymbol;
  }

  public void setGeneratorIsSymbol(boolean generatorIsSymbol) {
    this.generatorIsSymbol = generatorIsSymbol;
  }

  public String getGeneratorVersion() {
    return generatorVersion;
  }

  public void setGeneratorVersion(String generatorVersion) {
    this.generatorVersion = generatorVersion;
  }

  /** @return the diagnostics in the order they were found, mutable */
  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public List<Diagnostic> getErrors() {
    return diagnostics.stream().filter(Diagnostic::isError).collect(Collectors.toList());
  }

  public List<Diagnostic> getWarnings() {
    return diagnostics.stream().filter(d -> !d.isError()).collect(Collectors.toList());
  }

  public boolean hasErrors() {
    return diagnostics.stream().anyMatch(Diagnostic::isError);
  }

  /**
   * The parsed tree the document was read from, when {@link FormatOptions#retainSourceTree()} is
   * enabled.
   *
   * @return the source tree or null
   */
  public Node getSourceTree() {
    return sourceTree;
  }

  public void setSourceTree(Node sourceTree) {
    this.sourceTree = sourceTree;
  }
}
