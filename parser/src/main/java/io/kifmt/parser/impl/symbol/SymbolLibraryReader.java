package io.kifmt.parser.impl.symbol;

import io.kifmt.parser.api.DocumentKind;
import io.kifmt.parser.api.KiCadFileException;
import io.kifmt.parser.api.symbol.SymbolLibrary;
import io.kifmt.parser.impl.DocumentReader;
import io.kifmt.parser.impl.Headers;
import io.kifmt.parser.internal_api.DispatchTable;
import io.kifmt.parser.internal_api.NodeCursor;
import io.kifmt.parser.internal_api.ReadContext;
import io.kifmt.sexpr.Node;

/** Reads {@code .kicad_sym} files and the {@code lib_symbols} section of schematics. */
public final class SymbolLibraryReader implements DocumentReader<SymbolLibrary> {
  /** Newest {@code kicad_symbol_lib} format version this reader was written for. */
  public static final int MAX_VERSION = 20241209;

  private static final DispatchTable<SymbolLibrary> TABLE =
      new DispatchTable<SymbolLibrary>()
          .on("symbol", LibSymbolReader::read, (lib, s) -> lib.getSymbols().add(s))
          .raw("embedded_fonts");

  @Override
  public SymbolLibrary read(Node root, ReadContext ctx) throws KiCadFileException {
    Headers.checkRoot(root, DocumentKind.SYMBOL_LIBRARY, ctx);
    NodeCursor c = NodeCursor.of(root, ctx);
    SymbolLibrary library = new SymbolLibrary();
    Headers.read(c, library, MAX_VERSION);
    readBody(c, library);
    return library;
  }

  /**
   * Reads the symbols of a library node.
   *
   * @param c the cursor over the library node
   * @param library the library to fill
   */
  public static void readBody(NodeCursor c, SymbolLibrary library) {
    TABLE.dispatch(c, library);
    TABLE.finish(c, library);
  }
}
