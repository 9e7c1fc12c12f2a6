package lrlab;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.*;
import java.util.logging.LogManager;

import lrlab.grammar.GrammarParser;
import lrlab.parser.ll.LLAnalyzer;
import lrlab.parser.lr.LRAnalyzer;
import lrlab.parser.lr.TableKind;
import minic.AstPrinter;
import minic.Compiler;
import minic.Token;

/**
 * Command line entry point.
 *
 * <pre>
 * analyze &lt;lr0|slr1|clr1|lalr1&gt; &lt;grammar-file&gt; [--dot &lt;file&gt;] [--svg &lt;file&gt;]
 * ll1 &lt;grammar-file&gt; [--transform]
 * compile &lt;source-file&gt; [--tokens] [--ast] [--symbols]
 * </pre>
 *
 * Exit status: 0 on success, 1 if conflicts or compilation errors were found, 2 on usage, I/O, config and
 * grammar errors.
 */
public class Main {

	public static final int SUCCESS = 0;
	public static final int FAILURE = 1;
	public static final int ERROR = 2;

	private static final String USAGE = "Usage:\n" +
			"  analyze <lr0|slr1|clr1|lalr1> <grammar-file> [--dot <file>] [--svg <file>]\n" +
			"  ll1 <grammar-file> [--transform]\n" +
			"  compile <source-file> [--tokens] [--ast] [--symbols]";

	private final PrintStream out;
	private final PrintStream err;

	public Main(PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		setupLogging();
		System.exit(new Main(System.out, System.err).run(args));
	}

	private static void setupLogging(){
		try (InputStream stream = Main.class.getResourceAsStream("/logging.properties")){
			if (stream != null){
				LogManager.getLogManager().readConfiguration(stream);
			}
		} catch (IOException e) {
			System.err.println("Can't read the logging configuration: " + e.getMessage());
		}
	}

	/**
	 * Runs the passed command and returns the exit status
	 */
	public int run(String[] args){
		if (args.length < 2){
			return usage(null);
		}
		List<String> rest = Arrays.asList(args).subList(1, args.length);
		try {
			Config.init();
			switch (args[0]){
				case "analyze":
					return analyze(rest);
				case "ll1":
					return ll1(rest);
				case "compile":
					return compile(rest);
				default:
					return usage("Unknown command " + args[0]);
			}
		} catch (IOException e) {
			err.println("I/O error: " + e.getMessage());
			return ERROR;
		} catch (LrlabException e) {
			err.println(e.getMessage());
			return ERROR;
		}
	}

	private int usage(String message){
		if (message != null){
			err.println(message);
		}
		err.println(USAGE);
		return ERROR;
	}

	private int analyze(List<String> args) throws IOException {
		if (args.size() < 2){
			return usage("analyze needs a table kind and a grammar file");
		}
		TableKind kind;
		try {
			kind = TableKind.fromName(args.get(0));
		} catch (LrlabException e) {
			return usage(e.getMessage());
		}
		String dotFile = null;
		String svgFile = null;
		for (int i = 2; i < args.size(); i++){
			String option = args.get(i);
			if ((option.equals("--dot") || option.equals("--svg")) && i + 1 < args.size()){
				if (option.equals("--dot")){
					dotFile = args.get(++i);
				} else {
					svgFile = args.get(++i);
				}
			} else {
				return usage("Unknown option " + option);
			}
		}
		LRAnalyzer analyzer = new LRAnalyzer(GrammarParser.parse(read(args.get(1))), kind);
		out.print(analyzer.report());
		String name = new File(args.get(1)).getName().replaceAll("\\W", "_");
		if (dotFile != null){
			Files.write(outputFile(dotFile).toPath(), analyzer.getAutomaton().toDot(name).getBytes(StandardCharsets.UTF_8));
		}
		if (svgFile != null){
			analyzer.getAutomaton().toSvg(name, outputFile(svgFile));
		}
		return analyzer.isInClass() ? SUCCESS : FAILURE;
	}

	private int ll1(List<String> args) throws IOException {
		boolean transform = false;
		for (String option : args.subList(1, args.size())){
			if (option.equals("--transform")){
				transform = true;
			} else {
				return usage("Unknown option " + option);
			}
		}
		LLAnalyzer analyzer = new LLAnalyzer(GrammarParser.parseRules(read(args.get(0))), transform);
		out.print(analyzer.report());
		return analyzer.isLL1() ? SUCCESS : FAILURE;
	}

	private int compile(List<String> args) throws IOException {
		Set<String> options = new HashSet<>(args.subList(1, args.size()));
		for (String option : options){
			if (!option.equals("--tokens") && !option.equals("--ast") && !option.equals("--symbols")){
				return usage("Unknown option " + option);
			}
		}
		Compiler.CompilationResult result = new Compiler().compile(read(args.get(0)));
		if (options.contains("--tokens")){
			out.println("Tokens:");
			for (Token token : result.tokens){
				out.println("  " + token.toStringWithLocation());
			}
		}
		if (options.contains("--ast") && result.program != null){
			out.println("AST:");
			out.print(new AstPrinter().print(result.program));
		}
		if (options.contains("--symbols") && result.symbolTable != null){
			out.println("Symbol table:");
			out.print(result.symbolTable.format());
		}
		if (!result.isSuccessful()){
			err.print(result.formatErrors());
			return FAILURE;
		}
		out.print(result.formatTac());
		return SUCCESS;
	}

	/**
	 * Relative paths of exported files are resolved against the configured output directory
	 */
	private static File outputFile(String path) throws IOException {
		File file = new File(path);
		if (!file.isAbsolute()){
			file = new File(Config.getOutputDir(), path);
		}
		File parent = file.getAbsoluteFile().getParentFile();
		if (parent != null && !parent.exists() && !parent.mkdirs()){
			throw new IOException("Can't create directory " + parent);
		}
		return file;
	}

	private static String read(String path) throws IOException {
		return new String(Files.readAllBytes(Paths.get(path)), StandardCharsets.UTF_8);
	}
}
