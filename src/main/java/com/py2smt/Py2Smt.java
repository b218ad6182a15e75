package com.py2smt;

import com.py2smt.smt.Sort;
import com.py2smt.smt.UnsupportedConstructException;
import com.py2smt.source.ParseException;
import com.py2smt.tree.SyntaxNode;
import com.py2smt.tree.SyntaxTreeJsonReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

@Command(name = "py2smt", mixinStandardHelpOptions = true, version = "1.0",
         description = "Translate a Python subset into SMT-LIB2 expressions")
public class Py2Smt implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(Py2Smt.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Input file (default: stdin)")
    private File inputFile;

    @Option(names = {"-s", "--sort"}, defaultValue = "Int", converter = SortConverter.class,
            description = "Sort of parameters and result: Int or Bool (default: ${DEFAULT-VALUE})")
    private Sort sort;

    @Option(names = "--strict", description = "Fail on unsupported constructs instead of emitting UNKNOWN_TYPE markers")
    private boolean strict = false;

    @Option(names = "--tree-json", description = "Read a JSON syntax tree instead of Python source")
    private boolean treeJson = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Py2Smt()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try (InputStream input = inputFile != null ? new FileInputStream(inputFile) : System.in) {
            PythonToSmtConverter converter = new PythonToSmtConverter(sort, strict);
            logger.debug("Converting {} with sort {} (strict={}, tree-json={})",
                    inputFile != null ? inputFile : "stdin", sort, strict, treeJson);

            String smt;
            if (treeJson) {
                SyntaxNode tree = new SyntaxTreeJsonReader().read(input);
                smt = converter.convert(tree);
            } else {
                smt = converter.convert(new String(input.readAllBytes(), StandardCharsets.UTF_8));
            }

            out.println(smt);
            out.flush();
            return 0;
        } catch (ParseException e) {
            err.println(e.getMessage());
            if (e.getText() != null) {
                err.println("    " + e.getText().strip());
            }
            err.flush();
            return 1;
        } catch (UnsupportedConstructException | IOException e) {
            logger.debug("Conversion failed", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    static class SortConverter implements CommandLine.ITypeConverter<Sort> {
        @Override
        public Sort convert(String value) {
            try {
                return Sort.parse(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
