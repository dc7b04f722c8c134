package com.flamingo.learn.downloader.service.http;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import org.springframework.http.MediaType;

/**
 * A completed HTTP exchange.
 *
 * @param status response status code
 * @param body response body, empty when the response had none
 * @param contentType value of the Content-Type header, {@code null} when absent
 */
public record HttpResult(int status, byte[] body, String contentType) {

  public HttpResult {
    body = body != null ? body : new byte[0];
  }

  public boolean isSuccess() {
    return status >= 200 && status < 300;
  }

  public boolean isNotFound() {
    return status == 404;
  }

  /** 429 and 5xx responses are worth another attempt. */
  public boolean isRetriable() {
    return status == 429 || status >= 500;
  }

  /** Decodes the body using the declared charset, UTF-8 otherwise. */
  public String bodyAsString() {
    Charset charset = StandardCharsets.UTF_8;
    if (contentType != null) {
      try {
        Charset declared = MediaType.parseMediaType(contentType).getCharset();
        if (declared != null) {
          charset = declared;
        }
      } catch (IllegalArgumentException e) {
        // unparseable header, keep UTF-8
      }
    }
    return new String(body, charset);
  }
}
