package io.blockperf.collector.infrastructure.sink;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import io.blockperf.collector.domain.block.BlockSample;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/**
 * Encodes {@link BlockSample}s as single-line JSON objects.
 *
 * <p>Timestamps are ISO-8601 instants; deltas and {@code blockG} are decimal seconds as strings (for example
 * {@code "0.3"} or {@code "-0.05"}) so no precision is lost to floating point.</p>
 *
 * @since 0.1.0
 */
public final class BlockSampleJson {
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Encodes one sample.
   *
   * @param sample sample to encode
   * @return JSON object text without a trailing newline
   */
  public String encode(BlockSample sample) {
    Objects.requireNonNull(sample, "sample");
    StringWriter out = new StringWriter(768);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeNumberField("magic", sample.magic());
      gen.writeStringField("bpVersion", sample.bpVersion());
      gen.writeNumberField("blockNo", sample.blockNo());
      gen.writeNumberField("slotNo", sample.slotNo());
      gen.writeStringField("blockHash", sample.blockHash());
      gen.writeNumberField("blockSize", sample.blockSize());
      gen.writeStringField("headerRemoteAddr", sample.headerRemoteAddr());
      gen.writeNumberField("headerRemotePort", sample.headerRemotePort());
      gen.writeStringField("slotTime", sample.slotTime().toString());
      gen.writeStringField("headerFirstSeen", sample.headerFirstSeen().toString());
      gen.writeStringField("blockRequestSent", sample.blockRequestSent().toString());
      gen.writeStringField("blockDownloadCompleted", sample.blockDownloadCompleted().toString());
      gen.writeStringField("blockAdopted", sample.blockAdopted().toString());
      gen.writeStringField("headerDelta", seconds(sample.headerDelta()));
      gen.writeStringField("blockReqDelta", seconds(sample.blockReqDelta()));
      gen.writeStringField("blockRspDelta", seconds(sample.blockRspDelta()));
      gen.writeStringField("blockAdoptDelta", seconds(sample.blockAdoptDelta()));
      gen.writeStringField("blockRemoteAddress", sample.blockRemoteAddress());
      gen.writeNumberField("blockRemotePort", sample.blockRemotePort());
      gen.writeStringField("blockLocalAddress", sample.blockLocalAddress());
      gen.writeNumberField("blockLocalPort", sample.blockLocalPort());
      gen.writeStringField("blockG", seconds(sample.blockG()));
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode block sample " + sample.blockHash(), ex);
    }
    return out.toString();
  }

  /**
   * Renders a duration as plain decimal seconds without trailing zeros.
   *
   * @param duration duration, possibly negative
   * @return e.g. {@code "0.3"}, {@code "-0.05"}, {@code "2"}
   */
  static String seconds(Duration duration) {
    BigDecimal value = BigDecimal.valueOf(duration.getSeconds())
        .add(BigDecimal.valueOf(duration.getNano(), 9));
    if (value.signum() == 0) {
      return "0";
    }
    return value.stripTrailingZeros().toPlainString();
  }
}
