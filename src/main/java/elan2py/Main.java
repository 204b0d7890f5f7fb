package elan2py;

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line wrapper: {@code elan2py <input.elan> [output.py]}.
 *
 * Exit codes: 0 on success or when only help was requested, 1 on any error.
 */
public final class Main {
	private Main() {
	}

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	public static int run(String[] args, PrintStream out, PrintStream err) {
		return run(args, out, err, TranslatorConfig.defaults());
	}

	static int run(String[] args, PrintStream out, PrintStream err, TranslatorConfig config) {
		ArgumentParser parser = configureParser(config);
		if (args.length == 0) {
			printHelp(parser, out);
			return 0;
		}
		if (args.length > 2) {
			err.println("Error: Too many arguments provided.");
			err.println();
			printHelp(parser, err);
			return 1;
		}

		Namespace ns;
		try {
			ns = parser.parseArgs(args);
		} catch (ArgumentParserException e) {
			err.println("Error: " + e.getMessage());
			err.println();
			printHelp(parser, err);
			return 1;
		}
		if (Boolean.TRUE.equals(ns.getBoolean("help")) || ns.getString("input") == null) {
			printHelp(parser, out);
			return 0;
		}

		String inputName = ns.getString("input");
		String outputName = ns.getString("output");
		try {
			TranslationJob job = new TranslationJob(Path.of(inputName), Path.of(outputName),
					outputName.equals(config.defaultOutputName()), new Transpiler(config));
			List<String> warnings = job.validate();
			warnings.forEach(w -> out.println("Warning: " + w));
			String python = job.run();
			out.println("Successfully translated '" + inputName + "' to '" + outputName + "'");
			out.println("Output file size: " + python.length() + " characters");
			return 0;
		} catch (InvalidPathException e) {
			err.println("Error: invalid path: " + e.getMessage());
			return 1;
		} catch (TranslationException e) {
			err.println("Error: " + e.getMessage());
			return 1;
		}
	}

	static ArgumentParser configureParser(TranslatorConfig config) {
		ArgumentParser parser = ArgumentParsers.newFor("elan2py")
				.addHelp(false)
				.build()
				.description("Elan-to-Python Translator")
				.epilog("Examples:\n"
						+ "  elan2py program.elan\n"
						+ "  elan2py program.elan converted.py\n"
						+ "  elan2py examples/octagon.elan graphics/octagon.py");

		parser.addArgument("-h", "--help")
				.action(Arguments.storeTrue())
				.help("show this help message and exit");
		parser.addArgument("input")
				.nargs("?")
				.help("path to the input Elan source file (mandatory)");
		parser.addArgument("output")
				.nargs("?")
				.setDefault(config.defaultOutputName())
				.help("path to the output Python file (default: " + config.defaultOutputName()
						+ "); an existing file is only overwritten when it is the default");
		return parser;
	}

	private static void printHelp(ArgumentParser parser, PrintStream stream) {
		PrintWriter writer = new PrintWriter(stream);
		parser.printHelp(writer);
		writer.flush();
	}
}
