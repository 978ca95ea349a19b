package io.flymcp.examples.stdio;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.flymcp.server.McpHandler;
import io.flymcp.server.error.InvalidParamsException;
import io.flymcp.server.error.ResourceNotFoundException;
import io.flymcp.server.registry.ResourceDefinition;
import reactor.core.publisher.Mono;

/**
 * Keeps bounded in-memory logs of runs and serves them as {@code logs://run/<id>}
 * resources. Each log holds at most {@value #MAX_LOG_ENTRIES} entries and
 * {@value #MAX_LOG_BYTES} bytes; the oldest entries are dropped first.
 */
public class RunLogResourceProvider {

	public static final String URI_PREFIX = "logs://run/";

	public static final int MAX_LOG_BYTES = 100 * 1024;

	public static final int MAX_LOG_ENTRIES = 1000;

	private final Map<String, RunLog> logs = new ConcurrentHashMap<>();

	public void append(String runId, String entry) {
		logs.computeIfAbsent(runId, id -> new RunLog()).append(entry);
	}

	public boolean clear(String runId) {
		return logs.remove(runId) != null;
	}

	public boolean contains(String runId) {
		return logs.containsKey(runId);
	}

	/**
	 * Reads a byte range of a run log.
	 * @param uri the log URI
	 * @param start the first byte, clamped to the log size
	 * @param length the number of bytes, or {@code null} for the rest of the log
	 * @return {@code content}, {@code encoding}, {@code total}, {@code start} and
	 * {@code length} of the slice
	 */
	public Map<String, Object> read(String uri, int start, Integer length) {
		if (!uri.startsWith(URI_PREFIX)) {
			throw new ResourceNotFoundException(uri);
		}
		RunLog log = logs.get(uri.substring(URI_PREFIX.length()));
		if (log == null) {
			throw new ResourceNotFoundException(uri);
		}
		byte[] bytes = log.text().getBytes(StandardCharsets.UTF_8);
		int from = Math.max(0, Math.min(start, bytes.length));
		int to = (length != null) ? (int) Math.max(from, Math.min((long) from + length, bytes.length))
				: bytes.length;

		Map<String, Object> slice = new LinkedHashMap<>();
		slice.put("content", new String(bytes, from, to - from, StandardCharsets.UTF_8));
		slice.put("encoding", "utf-8");
		slice.put("total", bytes.length);
		slice.put("start", from);
		slice.put("length", to - from);
		return slice;
	}

	/**
	 * Returns the resource serving every URI below {@value #URI_PREFIX}. Reads accept
	 * optional {@code start} and {@code length} byte offsets.
	 * @return the resource definition
	 */
	public ResourceDefinition definition() {
		McpHandler handler = (params, token, progress) -> Mono.fromCallable(() -> read(String.valueOf(params.get("uri")),
				intParam(params, "start", 0), intParam(params, "length", null)));
		return ResourceDefinition.builder()
			.uri(URI_PREFIX)
			.name("run-logs")
			.description("Output of runs started by the process tool")
			.mimeType("application/json")
			.readOnly(true)
			.handler(handler)
			.build();
	}

	private static Integer intParam(Map<String, Object> params, String name, Integer defaultValue) {
		Object value = params.get(name);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Number number) {
			return number.intValue();
		}
		throw new InvalidParamsException(name + " must be a number");
	}

	private static final class RunLog {

		private final Deque<String> entries = new ArrayDeque<>();

		private int bytes;

		synchronized void append(String entry) {
			entries.addLast(entry);
			bytes += size(entry);
			while (entries.size() > MAX_LOG_ENTRIES || (bytes > MAX_LOG_BYTES && !entries.isEmpty())) {
				bytes -= size(entries.removeFirst());
			}
		}

		synchronized String text() {
			return String.join("\n", entries);
		}

		private static int size(String entry) {
			return entry.getBytes(StandardCharsets.UTF_8).length;
		}

	}

}
