package io.kifmt.parser.api;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** The four KiCad document kinds, with their root tokens and file extensions. */
public enum DocumentKind {
  SYMBOL_LIBRARY(".kicad_sym", "kicad_symbol_lib"),
  SCHEMATIC(".kicad_sch", "kicad_sch"),
  FOOTPRINT(".kicad_mod", "footprint", "module"),
  BOARD(".kicad_pcb", "kicad_pcb");

  private final String extension;
  private final List<String> rootTokens;

  DocumentKind(String extension, String... rootTokens) {
    this.extension = extension;
    this.rootTokens = List.of(rootTokens);
  }

  public String extension() {
    return extension;
  }

  /** @return the accepted root tokens, the modern one first */
  public List<String> rootTokens() {
    return rootTokens;
  }

  /** @return the root token written for new documents */
  public String rootToken() {
    return rootTokens.get(0);
  }

  public boolean acceptsRoot(String token) {
    return rootTokens.contains(token);
  }

  /**
   * Finds the kind for a file name by its extension, ignoring case.
   *
   * @param fileName the file name
   * @return the kind, or empty if the extension is not a KiCad one
   */
  public static Optional<DocumentKind> forFileName(String fileName) {
    String lower = fileName.toLowerCase(Locale.ROOT);
    for (DocumentKind kind : values()) {
      if (lower.endsWith(kind.extension)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
