package io.kifmt.parser.api.symbol;

import io.kifmt.parser.api.DocumentKind;
import io.kifmt.parser.api.KiCadDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A symbol library, {@code .kicad_sym}. The same type holds the {@code lib_symbols} cache
 * embedded in a schematic; that one has no header fields.
 */
public class SymbolLibrary extends KiCadDocument {
  private final List<LibSymbol> symbols = new ArrayList<>();

  @Override
  public DocumentKind kind() {
    return DocumentKind.SYMBOL_LIBRARY;
  }

  /** @return the symbols in file order, mutable */
  public List<LibSymbol> getSymbols() {
    return symbols;
  }

  public Optional<LibSymbol> get(String name) {
    return symbols.stream().filter(s -> s.getName().equals(name)).findFirst();
  }

  public boolean contains(String name) {
    return get(name).isPresent();
  }

  /**
   * Appends a symbol.
   *
   * @param symbol the symbol to add
   * @throws IllegalArgumentException if a symbol with the same name exists
   */
  public void add(LibSymbol symbol) {
    if (contains(symbol.getName())) {
      throw new IllegalArgumentException("Symbol already exists: " + symbol.getName());
    }
    symbols.add(symbol);
  }

  /**
   * Removes a symbol by name.
   *
   * @param name the symbol name
   * @return whether a symbol was removed
   */
  public boolean remove(String name) {
    return symbols.removeIf(s -> s.getName().equals(name));
  }

  public List<String> names() {
    return symbols.stream().map(LibSymbol::getName).collect(Collectors.toList());
  }
}
