package com.mindmarker.cli;

import com.mindmarker.compiler.CompileResult;
import com.mindmarker.compiler.MarkerCompiler;
import com.mindmarker.config.CompilerProperties;
import com.mindmarker.config.MarkerCompilerFactory;
import com.mindmarker.error.CompileException;
import com.mindmarker.feature.Feature;
import com.mindmarker.markerFile.MarkerDecoder;
import com.mindmarker.markerFile.MarkerFile;
import com.mindmarker.markerFile.MarkerTarget;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line front end.
 * <pre>
 *   compile &lt;image&gt; [output.mind]
 *   inspect &lt;file.mind&gt;
 * </pre>
 */
public class MarkerCompilerMain {
    static final int OK = 0;
    static final int USAGE = 2;
    static final int FAILED = 1;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 2) {
            usage(err);
            return USAGE;
        }
        try {
            switch (args[0]) {
                case "compile":
                    Path input = Paths.get(args[1]);
                    Path output = args.length > 2 ? Paths.get(args[2]) : defaultOutput(input);
                    return compile(input, output, out);
                case "inspect":
                    return inspect(Paths.get(args[1]), out);
                default:
                    usage(err);
                    return USAGE;
            }
        } catch (CompileException e) {
            err.println(e.getKind() + ": " + e.getMessage());
            return FAILED;
        } catch (IOException e) {
            err.println("IO: " + e.getMessage());
            return FAILED;
        }
    }

    static int compile(Path input, Path output, PrintStream out) throws IOException, CompileException {
        MarkerCompiler compiler = MarkerCompilerFactory.create(new CompilerProperties());
        CompileResult result = compiler.compile(Files.readAllBytes(input));
        Files.write(output, result.getBytes());
        out.println("Wrote " + output + " (" + result.size() + " bytes, " + result.getFeatureCount()
                + " features, source " + result.getFeatureSource() + ")");
        if (result.isDegraded()) {
            out.println("WARNING: degraded target: " + result.getOutcome().getNote());
        }
        for (String issue : result.getReport().getIssues()) {
            out.println("  issue: " + issue);
        }
        return OK;
    }

    static int inspect(Path file, PrintStream out) throws IOException, CompileException {
        MarkerFile marker = new MarkerDecoder().decode(Files.readAllBytes(file));
        out.println(file + ": format version " + marker.getVersion() + ", " + marker.targetCount() + " target(s)");
        for (MarkerTarget target : marker.getTargets()) {
            out.println("  " + target);
            int shown = Math.min(5, target.getFeatures().size());
            for (int i = 0; i < shown; i++) {
                Feature f = target.getFeatures().get(i);
                out.println("    " + f);
            }
        }
        return OK;
    }

    static Path defaultOutput(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        Path parent = input.toAbsolutePath().getParent();
        return parent.resolve(base + ".mind");
    }

    private static void usage(PrintStream err) {
        err.println("usage: MarkerCompilerMain compile <image> [output.mind]");
        err.println("       MarkerCompilerMain inspect <file.mind>");
    }
}
