package io.kifmt.parser.impl.symbol;

import io.kifmt.parser.api.DocumentKind;
import io.kifmt.parser.api.symbol.LibSymbol;
import io.kifmt.parser.api.symbol.SymbolLibrary;
import io.kifmt.parser.impl.DocumentWriter;
import io.kifmt.parser.impl.Headers;
import io.kifmt.parser.internal_api.Encoders;
import io.kifmt.sexpr.Node;

public final class SymbolLibraryWriter implements DocumentWriter<SymbolLibrary> {
  /** Token of the symbol library embedded in a schematic. */
  public static final String EMBEDDED = "lib_symbols";

  @Override
  public Node write(SymbolLibrary library) {
    Node.Builder b = Node.builder(DocumentKind.SYMBOL_LIBRARY.rootToken());
    Headers.write(b, library);
    return writeBody(b, library);
  }

  /** Writes a library as the {@code lib_symbols} section of a schematic. */
  public static Node writeEmbedded(SymbolLibrary library) {
    return writeBody(Node.builder(EMBEDDED), library);
  }

  private static Node writeBody(Node.Builder b, SymbolLibrary library) {
    for (LibSymbol symbol : library.getSymbols()) {
      b.child(LibSymbolWriter.write(symbol));
    }
    return Encoders.finish(b, library);
  }
}
