package io.kifmt.parser.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.kifmt.parser.Fixtures;
import io.kifmt.parser.api.pcb.Footprint;
import io.kifmt.sexpr.SExpressionParser;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.Test;

class KiCadFormatErrorsTest {
  private final KiCadFormat<Footprint> format = KiCadFormat.footprint();

  @Test
  void wrongRootIsRejected() {
    KiCadFileException e =
        assertThrows(KiCadFileException.class, () -> format.parse("(kicad_pcb (version 1))"));

    assertThat(e.getErrorCode()).isEqualTo(KiCadFileException.ROOT);
    assertThat(e.getMessage()).contains("kicad_pcb").contains("footprint");
  }

  @Test
  void wrongRootNamesItsSource() throws Exception {
    Path path = Fixtures.path(Fixtures.MODERN_FOOTPRINT);

    KiCadFileException e =
        assertThrows(KiCadFileException.class, () -> KiCadFormat.board().read(path));

    assertThat(e.getErrorCode()).isEqualTo(KiCadFileException.ROOT);
    assertThat(e.getContext()).isEqualTo(path.toString());
    assertThat(e.getMessage()).contains("[Context: " + path + "]");
    assertThat(
            assertThrows(
                    KiCadFileException.class,
                    () -> format.fromTree(SExpressionParser.parse("(kicad_sch)")))
                .getContext())
        .isEqualTo("<tree>");
  }

  @Test
  void rootWithoutNameIsASyntaxError() {
    KiCadFileException e =
        assertThrows(KiCadFileException.class, () -> format.parse("(footprint (layer \"F.Cu\"))"));

    assertThat(e.getErrorCode()).isEqualTo(KiCadFileException.SYNTAX);
    assertThat(e.getContext()).isEqualTo("<text>");
    assertThat(e.getMessage()).contains("footprint name");
  }

  @Test
  void malformedRootPositionIsASyntaxError() {
    KiCadFileException e =
        assertThrows(KiCadFileException.class, () -> format.parse("(footprint \"X\" (at 1))"));

    assertThat(e.getErrorCode()).isEqualTo(KiCadFileException.SYNTAX);
    assertThat(e.getMessage()).contains("(at)");
    assertThat(e.getCause()).isInstanceOf(RuntimeException.class);
  }

  @Test
  void syntaxErrorCarriesPosition() {
    KiCadFileException e =
        assertThrows(
            KiCadFileException.class, () -> format.parse("(footprint \"X\"\n  \"unterminated)"));

    assertThat(e.getErrorCode()).isEqualTo(KiCadFileException.SYNTAX);
    assertThat(e.getLine()).isEqualTo(2);
    assertThat(e.getColumn()).isEqualTo(3);
    assertThat(e.getContext()).isEqualTo("<text>");
  }

  @Test
  void emptyInputIsASyntaxError() {
    KiCadFileException e = assertThrows(KiCadFileException.class, () -> format.parse("   \n"));

    assertThat(e.getErrorCode()).isEqualTo(KiCadFileException.SYNTAX);
    assertThatThrownBy(() -> format.parse("(footprint \"X\""))
        .isInstanceOf(KiCadFileException.class)
        .hasMessageContaining("missing ')'");
  }

  @Test
  void failingStreamIsAnIoError() throws Exception {
    InputStream in = mock(InputStream.class);
    when(in.read(any(byte[].class), anyInt(), anyInt())).thenThrow(new IOException("boom"));

    KiCadFileException e = assertThrows(KiCadFileException.class, () -> format.read(in));

    assertThat(e.getErrorCode()).isEqualTo(KiCadFileException.IO);
    assertThat(e.getCause()).hasMessage("boom");
  }

  @Test
  void missingFileIsAnIoError() {
    KiCadFileException e =
        assertThrows(
            KiCadFileException.class, () -> format.read(Path.of("does-not-exist.kicad_mod")));

    assertThat(e.getErrorCode()).isEqualTo(KiCadFileException.IO);
    assertThat(e.getContext()).isEqualTo("does-not-exist.kicad_mod");
  }

  @Test
  void failingOutputIsAnIoError() throws Exception {
    Footprint fp = format.read(Fixtures.path(Fixtures.MODERN_FOOTPRINT));
    OutputStream out = mock(OutputStream.class);
    doThrow(new IOException("disk full")).when(out).write(any(byte[].class), anyInt(), anyInt());

    KiCadFileException e = assertThrows(KiCadFileException.class, () -> format.write(fp, out));

    assertThat(e.getErrorCode()).isEqualTo(KiCadFileException.IO);
    assertThat(e.getContext()).isEqualTo("<stream>");
  }

  @Test
  void cancelledBeforeReading() throws Exception {
    BooleanSupplier cancelled = mock(BooleanSupplier.class);
    when(cancelled.getAsBoolean()).thenReturn(true);
    InputStream in = mock(InputStream.class);

    KiCadFileException e =
        assertThrows(
            KiCadFileException.class, () -> format.read(in, CancellationToken.of(cancelled)));

    assertThat(e.getErrorCode()).isEqualTo(KiCadFileException.CANCELLED);
    verifyNoInteractions(in);
  }

  @Test
  void cancelledBetweenChunks() throws Exception {
    BooleanSupplier cancelled = mock(BooleanSupplier.class);
    when(cancelled.getAsBoolean()).thenReturn(false, true);
    byte[] bytes = Fixtures.text(Fixtures.MODERN_FOOTPRINT).getBytes(StandardCharsets.UTF_8);

    KiCadFileException e =
        assertThrows(
            KiCadFileException.class,
            () -> format.read(new ByteArrayInputStream(bytes), CancellationToken.of(cancelled)));

    assertThat(e.getErrorCode()).isEqualTo(KiCadFileException.CANCELLED);
    verify(cancelled, times(2)).getAsBoolean();
  }

  @Test
  void cancelledWriteTouchesNothing() throws Exception {
    Footprint fp = format.read(Fixtures.path(Fixtures.MODERN_FOOTPRINT));
    OutputStream out = mock(OutputStream.class);

    KiCadFileException e =
        assertThrows(
            KiCadFileException.class,
            () -> format.write(fp, out, CancellationToken.of(() -> true)));

    assertThat(e.getErrorCode()).isEqualTo(KiCadFileException.CANCELLED);
    verifyNoInteractions(out);
  }

  @Test
  void uncancelledWriteMatchesString() throws Exception {
    Footprint fp = format.read(Fixtures.path(Fixtures.MODERN_FOOTPRINT));
    ByteArrayOutputStream out = new ByteArrayOutputStream();

    format.write(fp, out, CancellationToken.none());

    assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo(format.writeToString(fp));
  }

  @Test
  void detectsFormatByExtension() throws Exception {
    assertThat(KiCadFormat.detect(Path.of("a", "demo.kicad_pcb")).kind())
        .isEqualTo(DocumentKind.BOARD);
    assertThat(KiCadFormat.detect(Path.of("power.kicad_sym")).kind())
        .isEqualTo(DocumentKind.SYMBOL_LIBRARY);

    KiCadFileException e =
        assertThrows(KiCadFileException.class, () -> KiCadFormat.detect(Path.of("notes.txt")));
    assertThat(e.getErrorCode()).isEqualTo(KiCadFileException.UNSUPPORTED);
  }

  @Test
  void elementErrorsDoNotThrow() throws Exception {
    Footprint fp = format.parse("(footprint \"X\" (pad) (fp_line (start 0 0)))");

    assertThat(fp.hasErrors()).isTrue();
    assertThat(fp.getErrors()).hasSize(2);
    assertThat(fp.getPads()).isEmpty();
    assertThat(fp.getGraphics()).isEmpty();
  }
}
