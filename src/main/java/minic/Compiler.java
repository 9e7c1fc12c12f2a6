package minic;

import java.util.*;
import java.util.logging.Logger;

import static minic.Parser.ProgramNode;

/**
 * Runs lexer, parser, semantic analysis and TAC generation.
 *
 * Every phase runs over the whole input and collects its errors, the pipeline halts after the first
 * phase that reported errors.
 */
public class Compiler {

    private static final Logger LOG = Logger.getLogger("Compiler");

    public static class CompilationResult {

        public final List<Token> tokens;

        /**
         * Null if the lexer reported errors
         */
        public final ProgramNode program;

        /**
         * Null if the analysis didn't run
         */
        public final SymbolTable symbolTable;

        /**
         * Null if the analysis didn't run
         */
        public final TypeAnnotations annotations;

        public final List<CompilerError> lexicalErrors;
        public final List<CompilerError> syntaxErrors;
        public final List<CompilerError> semanticErrors;

        /**
         * Null if the pipeline halted
         */
        public final List<String> tac;

        /**
         * Phase after which the pipeline halted, null if it completed
         */
        public final CompilerError.Phase haltedAfter;

        CompilationResult(List<Token> tokens, ProgramNode program, SymbolTable symbolTable, TypeAnnotations annotations,
                          List<CompilerError> lexicalErrors, List<CompilerError> syntaxErrors,
                          List<CompilerError> semanticErrors, List<String> tac, CompilerError.Phase haltedAfter) {
            this.tokens = Collections.unmodifiableList(tokens);
            this.program = program;
            this.symbolTable = symbolTable;
            this.annotations = annotations;
            this.lexicalErrors = Collections.unmodifiableList(lexicalErrors);
            this.syntaxErrors = Collections.unmodifiableList(syntaxErrors);
            this.semanticErrors = Collections.unmodifiableList(semanticErrors);
            this.tac = tac;
            this.haltedAfter = haltedAfter;
        }

        public boolean isSuccessful() {
            return haltedAfter == null;
        }

        /**
         * Errors of all phases in phase order
         */
        public List<CompilerError> getErrors() {
            List<CompilerError> errors = new ArrayList<>(lexicalErrors);
            errors.addAll(syntaxErrors);
            errors.addAll(semanticErrors);
            return errors;
        }

        public String formatTac() {
            if (tac == null) {
                return "";
            }
            return String.join("\n", tac) + "\n";
        }

        public String formatErrors() {
            StringBuilder builder = new StringBuilder();
            for (CompilerError error : getErrors()) {
                builder.append(error.getMessage()).append("\n");
            }
            return builder.toString();
        }
    }

    public CompilationResult compile(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.tokenize();
        List<CompilerError> lexicalErrors = lexer.getErrors();
        if (!lexicalErrors.isEmpty()) {
            return halt(CompilerError.Phase.LEXICAL, new CompilationResult(tokens, null, null, null, lexicalErrors,
                    Collections.emptyList(), Collections.emptyList(), null, CompilerError.Phase.LEXICAL));
        }
        Parser parser = new Parser(tokens);
        ProgramNode program = parser.parse();
        if (!parser.getErrors().isEmpty()) {
            return halt(CompilerError.Phase.SYNTAX, new CompilationResult(tokens, program, null, null, lexicalErrors,
                    parser.getErrors(), Collections.emptyList(), null, CompilerError.Phase.SYNTAX));
        }
        SemanticAnalyzer analyzer = new SemanticAnalyzer();
        analyzer.analyze(program);
        if (!analyzer.getErrors().isEmpty()) {
            return halt(CompilerError.Phase.SEMANTIC, new CompilationResult(tokens, program, analyzer.getSymbolTable(),
                    analyzer.getAnnotations(), lexicalErrors, parser.getErrors(), analyzer.getErrors(), null,
                    CompilerError.Phase.SEMANTIC));
        }
        List<String> tac = new TACGenerator(analyzer.getAnnotations()).generate(program);
        LOG.info(String.format("Compilation succeeded, %d tokens, %d TAC instructions", tokens.size(), tac.size()));
        return new CompilationResult(tokens, program, analyzer.getSymbolTable(), analyzer.getAnnotations(),
                lexicalErrors, parser.getErrors(), analyzer.getErrors(), tac, null);
    }

    private CompilationResult halt(CompilerError.Phase phase, CompilationResult result) {
        LOG.info(String.format("Compilation halted after the %s phase with %d error(s)", phase.displayName.toLowerCase(),
                result.getErrors().size()));
        return result;
    }
}
