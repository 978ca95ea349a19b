/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.json;

import java.util.function.Supplier;

/**
 * Strategy interface for resolving a {@link McpJsonMapper}. Implementations are
 * registered under {@code META-INF/services}.
 */
public interface McpJsonMapperSupplier extends Supplier<McpJsonMapper> {

}
