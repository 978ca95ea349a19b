/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.registry;

import io.flymcp.spec.McpSchema;
import io.flymcp.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * A readable resource. Resources are looked up by URI and admitted under
 * {@code resources/<name>}. A resource registered with a URI prefix such as
 * {@code logs://run/} also serves every URI starting with that prefix; its handler
 * receives the requested URI in the {@code uri} parameter.
 */
public class ResourceDefinition extends AbstractDefinition {

	public static final String ADMISSION_PREFIX = "resources/";

	private final String uri;

	private final String mimeType;

	private ResourceDefinition(Builder builder) {
		super(builder);
		Assert.hasText(builder.uri, "uri must not be empty");
		this.uri = builder.uri;
		this.mimeType = builder.mimeType;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String key() {
		return uri;
	}

	@Override
	public String admissionKey() {
		return ADMISSION_PREFIX + getName();
	}

	public String getUri() {
		return uri;
	}

	@Nullable
	public String getMimeType() {
		return mimeType;
	}

	/**
	 * Returns the metadata advertised by {@code resources/list}.
	 * @return the resource metadata
	 */
	public McpSchema.Resource toResource() {
		return new McpSchema.Resource(uri, getName(), getDescription(), mimeType, trueOrNull(isReadOnly()));
	}

	public static class Builder extends AbstractBuilder<ResourceDefinition, Builder> {

		private String uri;

		private String mimeType = "text/plain";

		public Builder uri(String uri) {
			this.uri = uri;
			return this;
		}

		public Builder mimeType(String mimeType) {
			this.mimeType = mimeType;
			return this;
		}

		@Override
		protected Builder self() {
			return this;
		}

		@Override
		public ResourceDefinition build() {
			return new ResourceDefinition(this);
		}

	}

}
