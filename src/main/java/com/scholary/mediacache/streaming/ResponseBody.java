package com.scholary.mediacache.streaming;

import java.io.IOException;
import java.io.OutputStream;

/** Body of a media response, written once to the client. */
public interface ResponseBody {

  /** Number of bytes {@link #writeTo(OutputStream)} will write when the store behaves. */
  long contentLength();

  /**
   * Write the body.
   *
   * @throws IOException if the client went away
   */
  void writeTo(OutputStream out) throws IOException;

  /** Stop producing. Bodies that do no remote work ignore this. */
  default void cancel() {}
}
