package net.littleredcomputer.walksat;

import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Main {
    private static final Pattern langfordRe = Pattern.compile("langford(\\d+)");
    private static final Pattern waerdenRe = Pattern.compile("waerden(\\d+),(\\d+),(\\d+)");
    private static final Pattern randomRe = Pattern.compile("rand(\\d+),(\\d+),(\\d+),(-?\\d+)");

    static Options options() {
        return new Options()
                .addOption("problem", true, "filename of problem description, - for stdin, or a generator "
                        + "(langfordN, waerdenJ,K,N, randK,M,N,SEED)")
                .addOption("seed", true, "random seed")
                .addOption("maxsteps", true, "give up after this many flips")
                .addOption("noise", true, "initial noise level, 0-100")
                .addOption("greedy", false, "hold the noise level fixed")
                .addOption("check", false, "verify internal consistency after every flip")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader problem(String p) throws FileNotFoundException {
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
    }

    static Problem problem(CommandLine cmd) throws FileNotFoundException {
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem");
        String p = cmd.getOptionValue("problem");
        Matcher lm = langfordRe.matcher(p);
        if (lm.matches()) return Problem.langford(Integer.parseInt(lm.group(1)));
        Matcher wm = waerdenRe.matcher(p);
        if (wm.matches()) {
            return Problem.waerden(Integer.parseInt(wm.group(1)),
                    Integer.parseInt(wm.group(2)),
                    Integer.parseInt(wm.group(3)));
        }
        Matcher rm = randomRe.matcher(p);
        if (rm.matches()) {
            return Problem.randomInstance(Integer.parseInt(rm.group(1)),
                    Integer.parseInt(rm.group(2)),
                    Integer.parseInt(rm.group(3)),
                    Integer.parseInt(rm.group(4)));
        }
        // Didn't match a canned problem generator; try a file
        return Problem.parseFrom(problem(p));
    }

    static WalkSAT solver(Problem p, CommandLine cmd) {
        WalkSAT w = new WalkSAT(p, new SGBRandom(Integer.parseInt(cmd.getOptionValue("seed", "0"))))
                .setAdaptiveNoise(!cmd.hasOption("greedy"))
                .setCheckConsistency(cmd.hasOption("check"))
                .setLogInterval(Duration.parse(cmd.getOptionValue("loginterval", "PT1S")));
        if (cmd.hasOption("noise")) w.state().setNoiseLevel(Integer.parseInt(cmd.getOptionValue("noise")));
        return w;
    }

    static void report(Problem p, Optional<boolean[]> outcome, PrintStream out) {
        if (outcome.isPresent()) {
            out.println("s SATISFIABLE");
            out.print("v");
            boolean[] bs = outcome.get();
            for (int i = 0; i < bs.length; ++i) out.print(" " + (bs[i] ? "" : "!") + p.proposition(i).name());
            out.println();
        } else {
            out.println("s UNKNOWN");
        }
    }

    public static void main(String[] args) throws ParseException, FileNotFoundException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Problem p = problem(cmd);
        System.out.printf("c %d propositions %d constraints%n", p.nPropositions(), p.nConstraints());
        Stopwatch sw = Stopwatch.createStarted();
        Optional<boolean[]> outcome = solver(p, cmd).solve(Long.parseLong(cmd.getOptionValue("maxsteps", "10000000")));
        sw.stop();
        System.out.println("c " + sw);
        report(p, outcome, System.out);
    }
}
