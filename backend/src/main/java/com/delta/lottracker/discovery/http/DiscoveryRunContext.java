package com.delta.lottracker.discovery.http;

public final class DiscoveryRunContext {
  private static final ThreadLocal<RunCancellation> CURRENT = new ThreadLocal<>();

  private DiscoveryRunContext() {}

  public static RunCancellation current() {
    return CURRENT.get();
  }

  public static Scope activate(RunCancellation cancellation) {
    CURRENT.set(cancellation);
    return () -> CURRENT.remove();
  }

  public interface Scope extends AutoCloseable {
    @Override
    void close();
  }
}
