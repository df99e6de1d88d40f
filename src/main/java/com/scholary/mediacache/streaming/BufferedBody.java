package com.scholary.mediacache.streaming;

import java.io.IOException;
import java.io.OutputStream;

/** Body already held in memory. */
public final class BufferedBody implements ResponseBody {

  private static final BufferedBody EMPTY = new BufferedBody(new byte[0]);

  private final byte[] data;

  public BufferedBody(byte[] data) {
    this.data = data;
  }

  public static BufferedBody empty() {
    return EMPTY;
  }

  public byte[] bytes() {
    return data;
  }

  @Override
  public long contentLength() {
    return data.length;
  }

  @Override
  public void writeTo(OutputStream out) throws IOException {
    out.write(data);
  }
}
