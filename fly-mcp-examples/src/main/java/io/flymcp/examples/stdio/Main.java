package io.flymcp.examples.stdio;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import io.flymcp.server.McpServerConfig;
import io.flymcp.server.McpStdioServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the example server on standard input and output. The configuration is read from
 * {@code fly-mcp.properties} on the classpath, overridden by the file given as first
 * argument and by system properties.
 */
public class Main {

	static final String CONFIG_RESOURCE = "fly-mcp.properties";

	public static void main(String[] args) {
		McpServerConfig config = McpServerConfig.fromProperties(loadProperties(args));

		// Logback reads these while initializing, so set them before the first logger
		System.setProperty(McpServerConfig.PREFIX + "log.level", config.getLogLevel());
		System.setProperty(McpServerConfig.PREFIX + "log.pattern", config.getLogPattern());
		Logger logger = LoggerFactory.getLogger(Main.class);

		McpStdioServer server = createServer(config, new RunLogResourceProvider());
		Runtime.getRuntime().addShutdownHook(new Thread(() -> server.closeGracefully().block()));
		logger.info("Serving on stdio");
		server.serve();
	}

	static McpStdioServer createServer(McpServerConfig config, RunLogResourceProvider runLogs) {
		return McpStdioServer.builder()
			.config(config)
			.tool(Tools.echo())
			.tool(Tools.process(runLogs))
			.tool(Tools.clearRunLog(runLogs))
			.resource(runLogs.definition())
			.prompt(Prompts.greeting())
			.build();
	}

	static Properties loadProperties(String[] args) {
		Properties properties = new Properties();
		try (InputStream in = Main.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
			if (in != null) {
				properties.load(in);
			}
			if (args.length > 0) {
				try (InputStream file = Files.newInputStream(Path.of(args[0]))) {
					properties.load(file);
				}
			}
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to load configuration", e);
		}
		for (String name : System.getProperties().stringPropertyNames()) {
			if (name.startsWith(McpServerConfig.PREFIX)) {
				properties.setProperty(name, System.getProperty(name));
			}
		}
		return properties;
	}

}
