package io.kifmt.parser;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/** Access to the documents under {@code src/test/resources/fixtures}. */
public final class Fixtures {
  public static final String LEGACY_FOOTPRINT = "legacy_R_0805.kicad_mod";
  public static final String MODERN_FOOTPRINT = "modern_SOT-23.kicad_mod";
  public static final String BOARD = "demo.kicad_pcb";
  public static final String SCHEMATIC = "demo.kicad_sch";
  public static final String SYMBOL_LIBRARY = "power.kicad_sym";

  public static final List<String> ALL =
      List.of(LEGACY_FOOTPRINT, MODERN_FOOTPRINT, BOARD, SCHEMATIC, SYMBOL_LIBRARY);

  private Fixtures() {}

  public static Path path(String name) {
    URL url = Fixtures.class.getClassLoader().getResource("fixtures/" + name);
    if (url == null) {
      throw new IllegalArgumentException("No fixture " + name);
    }
    try {
      return Paths.get(url.toURI());
    } catch (URISyntaxException e) {
      throw new IllegalStateException(e);
    }
  }

  public static String text(String name) {
    try {
      return Files.readString(path(name), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
