package io.kifmt.parser.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kifmt.parser.api.pcb.Footprint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class FormatOptionsTest {
  private static final String SAMPLE =
      "(footprint \"X\" (layer \"F.Cu\") (vendor_data 0.50 1e1)"
          + " (pad \"1\" smd rect (at 0.50 0) (size 1 1) (layers \"F.Cu\")))";

  @AfterEach
  void clearProperties() {
    System.clearProperty(FormatOptions.INDENT_PROPERTY);
    System.clearProperty(FormatOptions.COMPACT_PROPERTY);
    System.clearProperty(FormatOptions.PRESERVE_NUMBER_TEXT_PROPERTY);
    System.clearProperty(FormatOptions.RETAIN_SOURCE_TREE_PROPERTY);
  }

  @Test
  void defaultsWithoutProperties() {
    FormatOptions options = FormatOptions.defaults();

    assertThat(options.indent()).isEqualTo(2);
    assertThat(options.compact()).isTrue();
    assertThat(options.preserveNumberText()).isTrue();
    assertThat(options.retainSourceTree()).isFalse();
  }

  @Test
  void defaultsReadSystemProperties() {
    System.setProperty(FormatOptions.INDENT_PROPERTY, "4");
    System.setProperty(FormatOptions.COMPACT_PROPERTY, "false");
    System.setProperty(FormatOptions.RETAIN_SOURCE_TREE_PROPERTY, "true");

    FormatOptions options = FormatOptions.defaults();

    assertThat(options.indent()).isEqualTo(4);
    assertThat(options.compact()).isFalse();
    assertThat(options.retainSourceTree()).isTrue();
  }

  @Test
  void indentShowsInOutput() throws Exception {
    KiCadFormat<Footprint> format = KiCadFormat.footprint(FormatOptions.defaults().withIndent(4));

    String text = format.writeToString(format.parse(SAMPLE));

    assertThat(text).contains("\n    (layer \"F.Cu\")");
    assertThat(text).contains("\n        (at 0.5 0)");
  }

  @Test
  void verbatimNumberLiteralsCanBeNormalized() throws Exception {
    KiCadFormat<Footprint> keep = KiCadFormat.footprint();
    KiCadFormat<Footprint> normalize =
        KiCadFormat.footprint(FormatOptions.defaults().withPreserveNumberText(false));

    assertThat(keep.writeToString(keep.parse(SAMPLE))).contains("(vendor_data 0.50 1e1)");
    assertThat(normalize.writeToString(normalize.parse(SAMPLE))).contains("(vendor_data 0.5 10)");
  }

  @Test
  void rejectsIndentOutOfRange() {
    assertThatThrownBy(() -> FormatOptions.defaults().withIndent(9))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
