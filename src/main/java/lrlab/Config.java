package lrlab;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Logger;

/**
 * Global settings, the defaults can be overridden by a <code>config.ini</code> on the class path and then
 * by one in the working directory (or the file named by the {@link #configFileProperty} system property).
 * Each line has the form <code>key = value</code>. The files are read on first use.
 */
public class Config {

	private static final Logger LOG = Logger.getLogger("Config");

	public static final String configFile = "config.ini";

	/**
	 * System property naming the config file that overrides the class path one, defaults to {@link #configFile}
	 */
	public static final String configFileProperty = "lrlab.config";

	private static final Map<String, String> defaults = new HashMap<String, String>(){{
		put("followIterationLimit", "100");
		put("outputDir", "out");
		put("graphvizFont", "Helvetica");
		put("graphvizRankDir", "LR");
	}};

	private static final Map<String, String> config = new HashMap<>(defaults);

	private static boolean loaded = false;

	/** Maximum number of passes of the FOLLOW set calculation */
	public static int followIterationLimit(){
		init();
		return Integer.parseInt(config.get("followIterationLimit"));
	}

	/** Directory for exported automaton drawings */
	public static String getOutputDir(){
		init();
		return config.get("outputDir");
	}

	public static String getGraphvizFont(){
		init();
		return config.get("graphvizFont");
	}

	/** Graphviz rank direction of automaton drawings, one of TB, LR, BT and RL */
	public static String getGraphvizRankDir(){
		init();
		return config.get("graphvizRankDir");
	}

	public static String get(String key){
		init();
		return config.get(key);
	}

	/**
	 * Applies the settings of the passed config text on top of the loaded config files
	 */
	static synchronized void load(Reader reader, String source) throws IOException {
		init();
		apply(reader, source);
	}

	/**
	 * Nothing is applied if one of the values is invalid
	 */
	private static void apply(Reader reader, String source) throws IOException {
		Map<String, String> overrides = new HashMap<>();
		BufferedReader bufferedReader = new BufferedReader(reader);
		String line;
		while ((line = bufferedReader.readLine()) != null){
			line = line.trim();
			if (line.startsWith("#") || !line.contains("=")){
				continue;
			}
			String[] parts = line.split("=", 2);
			String key = parts[0].trim();
			String value = parts[1].trim();
			if (defaults.containsKey(key)){
				validate(key, value, source);
				overrides.put(key, value);
			} else {
				LOG.warning(String.format("Unknown config key \"%s\" in %s", key, source));
			}
		}
		config.putAll(overrides);
	}

	private static void validate(String key, String value, String source){
		if (key.equals("followIterationLimit")){
			try {
				if (Integer.parseInt(value) < 1){
					throw new LrlabException(String.format("%s in %s has to be positive", key, source));
				}
			} catch (NumberFormatException ex){
				throw new LrlabException(String.format("%s in %s isn't a number: %s", key, source, value), ex);
			}
		}
	}

	/**
	 * Loads the config files on first use, later calls do nothing
	 *
	 * @throws LrlabException if a config file can't be read or has invalid values
	 */
	public static synchronized void init(){
		if (loaded){
			return;
		}
		try (InputStream stream = Config.class.getResourceAsStream("/" + configFile)){
			if (stream != null){
				apply(new InputStreamReader(stream, StandardCharsets.UTF_8), "class path");
			}
			File file = new File(System.getProperty(configFileProperty, configFile));
			if (file.exists()){
				try (Reader reader = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)){
					apply(reader, file.getAbsolutePath());
				}
			}
		} catch (IOException e) {
			throw new LrlabException("Can't read " + configFile + ": " + e.getMessage(), e);
		}
		loaded = true;
	}

	/**
	 * Restores the defaults, the config files are loaded again on the next use
	 */
	static synchronized void reset(){
		config.clear();
		config.putAll(defaults);
		loaded = false;
	}
}
