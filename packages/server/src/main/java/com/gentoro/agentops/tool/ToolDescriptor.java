package com.gentoro.agentops.tool;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * Registered tool: name, description, input schema, local handler and an optional remote endpoint.
 *
 * <p>When {@link #remoteEndpoint()} is present the gateway calls the endpoint first and treats
 * {@link #handler()} as the fallback; without an endpoint the handler is the only implementation.
 * A remote-only tool (no handler) is allowed and simply has no fallback.
 *
 * <p>{@link #servedRemotely()} marks tools whose local handler may be exposed on the tool endpoint.
 * Everything else is only reachable in-process through the gateway.
 */
public final class ToolDescriptor {
  private final String name;
  private final String description;
  private final ToolProperty schema;
  private final ToolHandler handler;
  private final URI remoteEndpoint;
  private final boolean servedRemotely;

  public ToolDescriptor(
      String name, String description, ToolProperty schema, ToolHandler handler, URI remote) {
    this(name, description, schema, handler, remote, false);
  }

  public ToolDescriptor(
      String name,
      String description,
      ToolProperty schema,
      ToolHandler handler,
      URI remote,
      boolean servedRemotely) {
    this.name = Objects.requireNonNull(name, "name");
    this.description = Objects.requireNonNull(description, "description");
    this.schema = schema == null ? ToolProperty.object() : schema;
    this.handler = handler;
    this.remoteEndpoint = remote;
    this.servedRemotely = servedRemotely;
    if (name.isBlank()) {
      throw new IllegalArgumentException("tool name must not be blank");
    }
    if (handler == null && remote == null) {
      throw new IllegalArgumentException(
          "tool '" + name + "' needs a local handler, a remote endpoint, or both");
    }
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public ToolProperty schema() {
    return schema;
  }

  /** Local implementation; for remote tools this is the fallback. */
  public Optional<ToolHandler> handler() {
    return Optional.ofNullable(handler);
  }

  public Optional<URI> remoteEndpoint() {
    return Optional.ofNullable(remoteEndpoint);
  }

  public boolean isRemote() {
    return remoteEndpoint != null;
  }

  /** Whether the tool endpoint may serve this tool's local handler to other processes. */
  public boolean servedRemotely() {
    return servedRemotely;
  }

  /** Same tool bound to another endpoint, used when the endpoint comes from configuration. */
  public ToolDescriptor withRemoteEndpoint(URI endpoint) {
    return new ToolDescriptor(name, description, schema, handler, endpoint, servedRemotely);
  }

  /** Same tool served only by its local handler. */
  public ToolDescriptor localOnly() {
    return new ToolDescriptor(name, description, schema, handler, null, servedRemotely);
  }

  @Override
  public String toString() {
    return "ToolDescriptor{" + name + (isRemote() ? " @ " + remoteEndpoint : "") + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String name;
    private String description;
    private ToolProperty schema;
    private ToolHandler handler;
    private URI remoteEndpoint;
    private boolean servedRemotely;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder schema(ToolProperty schema) {
      this.schema = schema;
      return this;
    }

    public Builder handler(ToolHandler handler) {
      this.handler = handler;
      return this;
    }

    public Builder remoteEndpoint(URI remoteEndpoint) {
      this.remoteEndpoint = remoteEndpoint;
      return this;
    }

    public Builder servedRemotely(boolean servedRemotely) {
      this.servedRemotely = servedRemotely;
      return this;
    }

    public ToolDescriptor build() {
      return new ToolDescriptor(
          name, description, schema, handler, remoteEndpoint, servedRemotely);
    }
  }
}
