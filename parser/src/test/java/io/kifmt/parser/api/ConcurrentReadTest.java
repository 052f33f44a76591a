package io.kifmt.parser.api;

import static org.assertj.core.api.Assertions.assertThat;

import io.kifmt.parser.Fixtures;
import io.kifmt.parser.api.pcb.Footprint;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ConcurrentReadTest {

  @Test
  void sharedFormatReadsInParallel() throws Exception {
    KiCadFormat<Footprint> format = KiCadFormat.footprint();
    String text = Fixtures.text(Fixtures.MODERN_FOOTPRINT);
    String expected = format.writeToString(format.parse(text));

    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<String>> results = new ArrayList<>();
      for (int i = 0; i < 64; i++) {
        results.add(executor.submit(() -> format.writeToString(format.parse(text))));
      }
      for (Future<String> result : results) {
        assertThat(result.get(30, TimeUnit.SECONDS)).isEqualTo(expected);
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
