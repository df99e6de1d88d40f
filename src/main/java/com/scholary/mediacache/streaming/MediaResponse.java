package com.scholary.mediacache.streaming;

import org.springframework.http.HttpHeaders;

/**
 * What the HTTP layer sends back for a serve or head call.
 *
 * @param status HTTP status code, 200 or 206
 * @param headers response headers, Content-Length included
 * @param body the body; empty for head requests
 */
public record MediaResponse(int status, HttpHeaders headers, ResponseBody body) {

  public boolean isPartial() {
    return status == 206;
  }
}
