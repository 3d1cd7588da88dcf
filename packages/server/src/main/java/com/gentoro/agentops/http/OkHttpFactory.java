package com.gentoro.agentops.http;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  private static final OkHttpClient SHARED =
      new OkHttpClient.Builder()
          .connectTimeout(10, TimeUnit.SECONDS)
          .readTimeout(20, TimeUnit.SECONDS)
          .addInterceptor(new LoggingInterceptor())
          .build();

  /** Default client: 10s connect, 20s read. */
  public static OkHttpClient create() {
    return SHARED;
  }

  /**
   * Client whose whole call (connect, write, read) is bounded by {@code callTimeout}. Derived from
   * the shared client so connection pool and dispatcher are reused.
   */
  public static OkHttpClient create(Duration callTimeout) {
    return SHARED
        .newBuilder()
        .callTimeout(callTimeout)
        .connectTimeout(callTimeout)
        .readTimeout(callTimeout)
        .build();
  }
}
