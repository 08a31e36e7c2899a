package mixfix;

import mixfix.model.notation.PrecedenceLevel;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings of the notation subsystem. Defaults come from the classpath resource
 * {@value #DEFAULTS_RESOURCE}; a user configuration file may override any subset of them.
 */
public class MixfixOptions {
	public static final String DEFAULTS_RESOURCE = "/mixfix-defaults.json";

	// the entries table always covers levels 0 to 10 and the pattern entry
	public static final int ENTRY_COUNT = 12;

	public String defaultScope;
	public String universe;
	public List<String> entryNames;
	public int delimiterInnerLevel;
	public int delimiterOuterLevel;
	public boolean compactSymbols;
	public int boxIndent;

	private MixfixOptions() {}

	public static MixfixOptions defaults() {
		MixfixOptions options = new MixfixOptions();
		options.apply(readDefaults(), DEFAULTS_RESOURCE);
		return options;
	}

	public static MixfixOptions fromFile(String configFilePath) throws MixfixOptionException {
		MixfixOptions options = defaults();
		String s;
		try {
			s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new MixfixOptionException("Error reading configuration file: " + ex.getMessage());
		}
		options.apply(parse(s, configFilePath), configFilePath);
		return options;
	}

	public static MixfixOptions fromJSON(String json) throws MixfixOptionException {
		MixfixOptions options = defaults();
		options.apply(parse(json, "<inline>"), "<inline>");
		return options;
	}

	private static JSONObject readDefaults() {
		try (InputStream in = MixfixOptions.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (in == null) {
				throw new MixfixOptionException("missing resource " + DEFAULTS_RESOURCE);
			}
			return parse(IOUtils.toString(in, StandardCharsets.UTF_8), DEFAULTS_RESOURCE);
		} catch (IOException e) {
			throw new MixfixOptionException("Error reading " + DEFAULTS_RESOURCE + ": " + e.getMessage());
		}
	}

	private static JSONObject parse(String s, String origin) throws MixfixOptionException {
		try {
			return new JSONObject(s);
		} catch (JSONException e) {
			throw new MixfixOptionException(origin + ": parsing error: " + e.getMessage());
		}
	}

	private void apply(JSONObject config, String origin) throws MixfixOptionException {
		try {
			JSONObject scopes = config.optJSONObject("scopes");
			if (scopes != null && scopes.has("default")) {
				defaultScope = scopes.getString("default");
			}
			JSONObject grammar = config.optJSONObject("grammar");
			if (grammar != null) {
				if (grammar.has("universe")) {
					universe = grammar.getString("universe");
				}
				if (grammar.has("entries")) {
					JSONArray entries = grammar.getJSONArray("entries");
					if (entries.length() != ENTRY_COUNT) {
						throw new MixfixOptionException(origin + ": grammar.entries must name exactly " +
								ENTRY_COUNT + " entries, found " + entries.length());
					}
					List<String> names = new ArrayList<>();
					for (int i = 0; i < entries.length(); ++i) {
						names.add(entries.getString(i));
					}
					entryNames = Collections.unmodifiableList(names);
				}
			}
			JSONObject delimiters = config.optJSONObject("delimiters");
			if (delimiters != null) {
				delimiterInnerLevel = delimiters.optInt("inner_level", delimiterInnerLevel);
				delimiterOuterLevel = delimiters.optInt("outer_level", delimiterOuterLevel);
				checkLevel(origin, "delimiters.inner_level", delimiterInnerLevel);
				checkLevel(origin, "delimiters.outer_level", delimiterOuterLevel);
			}
			JSONObject printer = config.optJSONObject("printer");
			if (printer != null) {
				compactSymbols = printer.optBoolean("compact_symbols", compactSymbols);
				boxIndent = printer.optInt("box_indent", boxIndent);
			}
		} catch (JSONException e) {
			throw new MixfixOptionException(origin + ": " + e.getMessage());
		}
		if (defaultScope == null || defaultScope.isEmpty()) {
			throw new MixfixOptionException(origin + ": scopes.default must be a non-empty string");
		}
		if (entryNames == null) {
			throw new MixfixOptionException(origin + ": grammar.entries is required");
		}
	}

	private static void checkLevel(String origin, String key, int level) throws MixfixOptionException {
		if (level < PrecedenceLevel.MIN_LEVEL || level > PrecedenceLevel.MAX_LEVEL) {
			throw new MixfixOptionException(origin + ": " + key + " must be between " + PrecedenceLevel.MIN_LEVEL +
					" and " + PrecedenceLevel.MAX_LEVEL + ", found " + level);
		}
	}
}
