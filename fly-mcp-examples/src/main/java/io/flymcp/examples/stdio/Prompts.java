package io.flymcp.examples.stdio;

import java.util.List;

import io.flymcp.server.registry.PromptDefinition;
import io.flymcp.spec.McpSchema.GetPromptResult;
import io.flymcp.spec.McpSchema.PromptMessage;
import io.flymcp.spec.McpSchema.TextContent;
import reactor.core.publisher.Mono;

import static io.flymcp.spec.McpSchema.Role.USER;

public final class Prompts {

	private Prompts() {
	}

	public static PromptDefinition greeting() {
		return PromptDefinition.builder()
			.name("greeting")
			.description("Greeting Prompt")
			.argument("name", "Name of the person to greet", true)
			.handler((params, token, progress) -> Mono.just(new GetPromptResult("greeting",
					List.of(new PromptMessage(USER, new TextContent("Hello " + params.get("name") + "!"))))))
			.build();
	}

}
