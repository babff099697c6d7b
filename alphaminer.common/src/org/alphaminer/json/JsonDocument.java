package org.alphaminer.json;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

import org.apache.log4j.Logger;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * JsonDocument builds and manages a single JSON object. It supports appending key-value pairs, nested objects and
 * arrays, typed lookups, and reading/writing JSON files. Nested structures are stored as proper JSON objects/arrays so
 * that they are never encoded twice.
 */
@SuppressWarnings("unchecked")
public class JsonDocument {
	private static final Logger logger = Logger.getLogger(JsonDocument.class);

	/** The internal JSON object holding all key-value data. */
	private final JSONObject root;

	/** Creates an empty document. */
	public JsonDocument() {
		this.root = new JSONObject();
	}

	private JsonDocument(JSONObject root) {
		this.root = root;
	}

	/** ---------------------- Static helper methods ---------------------- **/

	/**
	 * Parses a JSON string whose top level must be an object.
	 *
	 * @throws ParseException
	 *             if the text is not valid JSON or its top level is not an object
	 */
	public static JsonDocument parse(String jsonString) throws ParseException {
		Object parsed = new JSONParser().parse(jsonString);
		if (!(parsed instanceof JSONObject)) {
			throw new ParseException(ParseException.ERROR_UNEXPECTED_TOKEN, parsed);
		}
		return new JsonDocument((JSONObject) parsed);
	}

	/** Reads and parses a JSON file. */
	public static JsonDocument loadFromFile(Path file) throws IOException, ParseException {
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			Object parsed = new JSONParser().parse(reader);
			if (!(parsed instanceof JSONObject)) {
				throw new ParseException(ParseException.ERROR_UNEXPECTED_TOKEN, parsed);
			}
			logger.debug("Loaded JSON document from " + file);
			return new JsonDocument((JSONObject) parsed);
		}
	}

	/** Builds a JSON array from a collection of strings. */
	public static JSONArray toArray(Collection<String> values) {
		JSONArray array = new JSONArray();
		array.addAll(values);
		return array;
	}

	/** Builds a JSON array of arrays, one per inner collection. */
	public static JSONArray toNestedArray(Collection<? extends Collection<String>> values) {
		JSONArray array = new JSONArray();
		for (Collection<String> inner : values) {
			array.add(toArray(inner));
		}
		return array;
	}

	/** ---------------------- Instance methods ---------------------- **/

	/** Sets a string value, replacing any previous one. */
	public JsonDocument put(String key, String value) {
		root.put(key, value);
		return this;
	}

	public JsonDocument put(String key, long value) {
		root.put(key, value);
		return this;
	}

	public JsonDocument put(String key, double value) {
		root.put(key, value);
		return this;
	}

	public JsonDocument put(String key, boolean value) {
		root.put(key, value);
		return this;
	}

	/** Appends a nested document under the given key. */
	public JsonDocument putObject(String key, JsonDocument nested) {
		root.put(key, nested.root);
		return this;
	}

	/** Appends an array of nested documents under the given key. */
	public JsonDocument putObjects(String key, List<JsonDocument> nested) {
		JSONArray array = new JSONArray();
		for (JsonDocument document : nested) {
			array.add(document.root);
		}
		root.put(key, array);
		return this;
	}

	/** Appends a prepared array under the given key. */
	public JsonDocument putArray(String key, JSONArray array) {
		root.put(key, array);
		return this;
	}


	public boolean hasKey(String key) {
		return root.containsKey(key);
	}

	/** Raw value for a key, or null when absent. */
	public Object get(String key) {
		return root.get(key);
	}

	/** String value of a key, or the default when absent or null. */
	public String getString(String key, String defaultValue) {
		Object value = root.get(key);
		return value != null ? value.toString() : defaultValue;
	}

	/**
	 * Nested object for a key, or null when absent.
	 *
	 * @throws IllegalArgumentException
	 *             if the value exists but is not an object
	 */
	public JsonDocument getObject(String key) {
		Object value = root.get(key);
		if (value == null) {
			return null;
		}
		if (!(value instanceof JSONObject)) {
			throw new IllegalArgumentException("Value of \"" + key + "\" is not a JSON object: " + value);
		}
		return new JsonDocument((JSONObject) value);
	}

	/**
	 * Array for a key, or null when absent.
	 *
	 * @throws IllegalArgumentException
	 *             if the value exists but is not an array
	 */
	public JSONArray getArray(String key) {
		Object value = root.get(key);
		if (value == null) {
			return null;
		}
		if (!(value instanceof JSONArray)) {
			throw new IllegalArgumentException("Value of \"" + key + "\" is not a JSON array: " + value);
		}
		return (JSONArray) value;
	}

	public int size() {
		return root.size();
	}

	/** Serialised form of the whole document. */
	public String toJSONString() {
		return root.toJSONString();
	}

	/** Writes the document to a file, creating parent directories as needed. */
	public void saveToFile(Path file) throws IOException {
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
			root.writeJSONString(writer);
		}
		logger.info("JSON document written to " + file);
	}

	@Override
	public String toString() {
		return toJSONString();
	}
}
