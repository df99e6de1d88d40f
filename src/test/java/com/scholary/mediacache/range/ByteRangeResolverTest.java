package com.scholary.mediacache.range;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ByteRangeResolverTest {

  private static final long MIB = 1024L * 1024L;

  private final ByteRangeResolver resolver = new ByteRangeResolver(20 * MIB, 10 * MIB);

  @Test
  void resolve_shouldClampEndToObjectSize() {
    RangeWindow window = resolver.resolve("bytes=0-1023", 1000);

    assertThat(window).isEqualTo(new RangeWindow(0, 999));
    assertThat(window.length()).isEqualTo(1000);
    assertThat(window.toContentRange(1000)).isEqualTo("bytes 0-999/1000");
  }

  @Test
  void resolve_shouldRunOpenEndedRangeToEndOfSmallObject() {
    assertThat(resolver.resolve("bytes=500-", 2000)).isEqualTo(new RangeWindow(500, 1999));
  }

  @Test
  void resolve_shouldCapOpenEndedRangeAtUnboundedLimit() {
    ByteRangeResolver small = new ByteRangeResolver(100, 1000);

    RangeWindow window = small.resolve("bytes=50-", 10_000);

    assertThat(window).isEqualTo(new RangeWindow(50, 149));
  }

  @Test
  void resolve_shouldTruncateLongWindowsAtTheTail() {
    RangeWindow window = resolver.resolve("bytes=100-" + (50 * MIB), 100 * MIB);

    assertThat(window.start()).isEqualTo(100);
    assertThat(window.length()).isEqualTo(10 * MIB);
  }

  @Test
  void resolve_shouldReturnWholeObjectWithoutHeader() {
    assertThat(resolver.resolve(null, 500 * MIB)).isEqualTo(new RangeWindow(0, 500 * MIB - 1));
    assertThat(resolver.resolve("  ", 10)).isEqualTo(new RangeWindow(0, 9));
  }

  @Test
  void resolve_shouldClampStartBeyondObjectToLastByte() {
    assertThat(resolver.resolve("bytes=5000-6000", 1000)).isEqualTo(new RangeWindow(999, 999));
  }

  @Test
  void resolve_shouldNotProduceInvertedWindow() {
    assertThat(resolver.resolve("bytes=50-10", 1000)).isEqualTo(new RangeWindow(50, 50));
  }

  @Test
  void resolve_shouldAcceptSurroundingWhitespace() {
    assertThat(resolver.resolve(" bytes=1-2 ", 10)).isEqualTo(new RangeWindow(1, 2));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "bytes=-500",
        "items=0-10",
        "bytes=a-b",
        "bytes=0-10,20-30",
        "0-10",
        "bytes=99999999999999999999-"
      })
  void resolve_shouldRejectMalformedHeaders(String header) {
    assertThatThrownBy(() -> resolver.resolve(header, 1000))
        .isInstanceOf(MalformedRangeException.class)
        .extracting(e -> ((MalformedRangeException) e).getRangeHeader())
        .isEqualTo(header);
  }

  @Test
  void resolve_shouldRejectEmptyObjects() {
    assertThatThrownBy(() -> resolver.resolve("bytes=0-1", 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void resolve_shouldAlwaysStayInsideObjectAndUnderChunkCap() {
    ByteRangeResolver tight = new ByteRangeResolver(64, 32);
    Random random = new Random(42);

    for (int i = 0; i < 2000; i++) {
      long size = 1 + random.nextInt(500);
      long start = random.nextInt((int) size);
      long end = start + random.nextInt((int) (size - start));

      RangeWindow window = tight.resolve("bytes=" + start + "-" + end, size);

      assertThat(window.start()).isBetween(0L, window.end());
      assertThat(window.end()).isLessThan(size);
      assertThat(window.length()).isLessThanOrEqualTo(32);
    }
  }

  @Test
  void resolve_shouldKeepOpenEndedRangesUnderUnboundedLimit() {
    ByteRangeResolver tight = new ByteRangeResolver(64, 1000);
    Random random = new Random(7);

    for (int i = 0; i < 2000; i++) {
      long size = 1 + random.nextInt(5000);
      long start = random.nextInt((int) size);

      RangeWindow window = tight.resolve("bytes=" + start + "-", size);

      assertThat(window.length()).isLessThanOrEqualTo(64);
      assertThat(window.end()).isLessThan(size);
    }
  }

  @Test
  void constructor_shouldRejectNonPositiveLimits() {
    assertThatThrownBy(() -> new ByteRangeResolver(0, 10))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ByteRangeResolver(10, -1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
