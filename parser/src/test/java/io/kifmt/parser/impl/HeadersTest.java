package io.kifmt.parser.impl;

import static org.assertj.core.api.Assertions.assertThat;

import io.kifmt.parser.api.KiCadFormat;
import io.kifmt.parser.api.model.TitleBlock;
import io.kifmt.parser.api.pcb.Board;
import io.kifmt.sexpr.SExpressionParser;
import org.junit.jupiter.api.Test;

class HeadersTest {
  private final KiCadFormat<Board> format = KiCadFormat.board();

  @Test
  void titleBlockCommentsKeepSourceOrder() throws Exception {
    String text =
        "(kicad_pcb (version 20240108) (title_block (title \"t\") (comment 2 \"second\")"
            + " (comment 1 \"first\")))";

    Board board = format.parse(text);

    TitleBlock tb = board.getTitleBlock();
    assertThat(tb.getComments())
        .extracting(TitleBlock.Comment::number)
        .containsExactly(2, 1);
    assertThat(tb.comment(1)).contains("first");
    assertThat(board.getDiagnostics()).isEmpty();
    assertThat(format.toTree(board)).isEqualTo(SExpressionParser.parse(text));
  }

  @Test
  void duplicateCommentIsKeptWithWarning() throws Exception {
    String text =
        "(kicad_pcb (version 20240108) (title_block (comment 1 \"a\") (comment 1 \"b\")))";

    Board board = format.parse(text);

    TitleBlock tb = board.getTitleBlock();
    assertThat(tb.getComments()).containsExactly(new TitleBlock.Comment(1, "a"));
    assertThat(tb.getRawChildren()).hasSize(1);
    assertThat(board.getWarnings())
        .singleElement()
        .satisfies(d -> assertThat(d.message()).contains("Duplicate comment 1"));
    assertThat(format.toTree(board)).isEqualTo(SExpressionParser.parse(text));
  }

  @Test
  void malformedCommentDoesNotHideLaterOnes() throws Exception {
    String text =
        "(kicad_pcb (version 20240108) (title_block (comment x \"bad\") (comment 3 \"ok\")))";

    Board board = format.parse(text);

    assertThat(board.getTitleBlock().comment(3)).contains("ok");
    assertThat(board.getWarnings())
        .singleElement()
        .satisfies(d -> assertThat(d.message()).startsWith("Unsupported form of 'comment'"));
    assertThat(format.toTree(board)).isEqualTo(SExpressionParser.parse(text));
  }
}
