package net.littleredcomputer.walksat;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.CharStreams;
import gnu.trove.list.array.TIntArrayList;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The immutable part of a satisfiability problem: the interned propositions and the
 * constraints over them. The mutable search state lives in {@link SearchState}, so one
 * problem may back any number of independent searches.
 */
public class Problem {
    private final ImmutableList<Proposition> propositions;
    private final ImmutableMap<String, Integer> propositionIndex;
    private final ImmutableList<Constraint> constraints;
    private final int nLiterals;
    private final int width;

    private Problem(Builder b) {
        final int n = b.names.size();
        List<TIntArrayList> positive = new ArrayList<>(n);
        List<TIntArrayList> negative = new ArrayList<>(n);
        for (int i = 0; i < n; ++i) {
            positive.add(new TIntArrayList());
            negative.add(new TIntArrayList());
        }
        int literals = 0, w = 0;
        for (Constraint c : b.constraints) {
            for (Literal l : c.literals()) {
                (l.negated() ? negative : positive).get(l.proposition()).add(c.index());
            }
            literals += c.size();
            if (c.size() > w) w = c.size();
        }
        ImmutableList.Builder<Proposition> pb = ImmutableList.builder();
        for (int i = 0; i < n; ++i) pb.add(new Proposition(i, b.names.get(i), positive.get(i), negative.get(i)));
        this.propositions = pb.build();
        this.propositionIndex = ImmutableMap.copyOf(b.index);
        this.constraints = ImmutableList.copyOf(b.constraints);
        this.nLiterals = literals;
        this.width = w;
    }

    public int nPropositions() { return propositions.size(); }
    public int nConstraints() { return constraints.size(); }
    public int nLiterals() { return nLiterals; }

    /** Length of the longest constraint. */
    public int width() { return width; }

    public ImmutableList<Proposition> propositions() { return propositions; }
    public ImmutableList<Constraint> constraints() { return constraints; }

    public Proposition proposition(int id) { return propositions.get(id); }
    public Optional<Proposition> proposition(String name) {
        return Optional.ofNullable(propositionIndex.get(name)).map(propositions::get);
    }

    public Constraint constraint(int index) { return constraints.get(index); }

    public String describe(Literal l) {
        return (l.negated() ? "!" : "") + propositions.get(l.proposition()).name();
    }

    /**
     * Evaluate the constraints at the specified point
     * @param p truth value of each proposition, indexed by proposition id
     * @return true if every constraint's true-literal count is within its range
     */
    public boolean evaluate(boolean[] p) {
        if (p.length != propositions.size()) throw new IllegalArgumentException("assignment has wrong length");
        return evaluate(TruthAssignment.of(p));
    }

    public boolean evaluate(TruthAssignment a) {
        for (Constraint c : constraints) {
            if (!c.inRange(a.trueLiteralCount(c))) return false;
        }
        return true;
    }

    public static Builder builder() { return new Builder(); }

    /**
     * Accumulates propositions and constraints. Proposition names are interned in
     * first-seen order, so ids form the dense range 0..n-1.
     */
    public static class Builder {
        private static final Pattern rangeRe = Pattern.compile("\\[\\s*(\\d+)\\s*,\\s*(\\d+)\\s*](.*)");
        private static final Splitter barSplitter = Splitter.on('|').trimResults();
        private static final CharMatcher reserved = CharMatcher.anyOf("!|[]");

        private final Map<String, Integer> index = new HashMap<>();
        private final List<String> names = new ArrayList<>();
        private final List<Constraint> constraints = new ArrayList<>();

        private Builder() {}

        /** @return the id of the named proposition, creating it if necessary */
        public int proposition(String name) {
            if (name.isEmpty()) throw new IllegalArgumentException("empty proposition name");
            Integer id = index.get(name);
            if (id != null) return id;
            index.put(name, names.size());
            names.add(name);
            return names.size() - 1;
        }

        public int nPropositions() { return names.size(); }

        public Builder addConstraint(List<Literal> literals, int min, int max) {
            for (Literal l : literals) {
                if (l.proposition() >= names.size()) {
                    throw new IllegalArgumentException("unknown proposition in literal " + l);
                }
            }
            constraints.add(new Constraint(constraints.size(), literals, min, max));
            return this;
        }

        /** Adds the ordinary disjunction of the literals. */
        public Builder addClause(List<Literal> literals) {
            return addConstraint(literals, 1, literals.size());
        }

        public Builder addClause(Literal... literals) {
            return addClause(Arrays.asList(literals));
        }

        /**
         * Parse one constraint of the form {@code [min,max] a | !b | c}. The range prefix
         * is optional; without it the constraint is the disjunction of the literals.
         * Nothing is interned unless the whole expression parses.
         * @throws ConstraintFormatException if the expression is malformed
         */
        public Builder addExpression(String expression) {
            String body = expression.trim();
            int min = -1, max = -1;
            if (body.startsWith("[")) {
                Matcher m = rangeRe.matcher(body);
                if (!m.matches()) throw new ConstraintFormatException("malformed range in: " + expression);
                try {
                    min = Integer.parseInt(m.group(1));
                    max = Integer.parseInt(m.group(2));
                } catch (NumberFormatException e) {
                    throw new ConstraintFormatException("range bound too large in: " + expression, e);
                }
                body = m.group(3).trim();
            }
            if (body.isEmpty()) throw new ConstraintFormatException("empty constraint: " + expression);
            List<String> terms = new ArrayList<>();
            List<Boolean> negations = new ArrayList<>();
            for (String term : barSplitter.split(body)) {
                if (term.isEmpty()) throw new ConstraintFormatException("missing literal in: " + expression);
                boolean negated = term.startsWith("!");
                String name = negated ? term.substring(1).trim() : term;
                if (name.isEmpty()) throw new ConstraintFormatException("negation without a proposition in: " + expression);
                if (reserved.matchesAnyOf(name)) {
                    throw new ConstraintFormatException("illegal proposition name \"" + name + "\" in: " + expression);
                }
                terms.add(name);
                negations.add(negated);
            }
            if (min < 0) {
                min = 1;
                max = terms.size();
            } else if (min > max || max > terms.size()) {
                throw new ConstraintFormatException("range [" + min + "," + max + "] impossible for "
                        + terms.size() + " literals in: " + expression);
            }
            List<Literal> literals = new ArrayList<>(terms.size());
            for (int i = 0; i < terms.size(); ++i) {
                literals.add(new Literal(proposition(terms.get(i)), negations.get(i)));
            }
            return addConstraint(literals, min, max);
        }

        public Problem build() {
            if (constraints.isEmpty()) throw new IllegalArgumentException("Problem has no constraints");
            return new Problem(this);
        }
    }

    public static Problem parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Read one constraint expression per line. Blank lines and lines starting with
     * {@code #} are skipped.
     * @throws ConstraintFormatException naming the offending line
     */
    public static Problem parseFrom(Reader r) {
        List<String> lines;
        try {
            lines = CharStreams.readLines(r);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        Builder b = builder();
        for (int i = 0; i < lines.size(); ++i) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            try {
                b.addExpression(line);
            } catch (ConstraintFormatException e) {
                throw new ConstraintFormatException("line " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        if (b.constraints.isEmpty()) throw new ConstraintFormatException("Missing constraint data");
        return b.build();
    }

    /**
     * Generate a random k-SAT instance in precisely the way Knuth does in Fascicle 6,
     * using the same random number generator and the clause generation technique found
     * in sat-rand-rep.w. Proposition x<i>i</i> has id i-1.
     *
     * @param k    size of each clause
     * @param m    number of clauses
     * @param n    number of propositions
     * @param seed for random number generator
     * @return random SAT instance
     */
    public static Problem randomInstance(int k, int m, int n, int seed) {
        if (k <= 0) throw new IllegalArgumentException("k must be positive!");
        if (m <= 0) throw new IllegalArgumentException("m must be positive!");
        if (n <= 0 || n > 100000000) throw new IllegalArgumentException("n must be between 1 and 99999999");
        if (k > n) throw new IllegalArgumentException("k mustn't exceed n!");
        final SGBRandom R = new SGBRandom(seed);
        Builder b = builder();
        for (int v = 1; v <= n; ++v) b.proposition("x" + v);
        int i, ii, t;
        for (int j = 0; j < m; j++) {
            List<Literal> clause = new ArrayList<>(k);
            for (int kk = k, nn = n; kk != 0; kk--, nn = ii) {
                // Set ii to the largest in a random kk out of nn
                for (ii = i = 0; i < kk; i++) {
                    t = i + R.unifRand(nn - i);
                    if (t > ii) ii = t;
                }
                clause.add(new Literal(ii, (R.nextRand() & 1) != 0));
            }
            b.addClause(clause);
        }
        return b.build();
    }

    /**
     * The problem waerden(j, k; n) of 7.2.2.2 (10): a binary string of length n with no
     * j equally-spaced 0s and no k equally-spaced 1s. Propositions are named 1..n.
     */
    public static Problem waerden(int j, int k, int n) {
        if (j < 2 || k < 2) throw new IllegalArgumentException("j and k must be at least 2");
        if (n < 1) throw new IllegalArgumentException("n must be positive");
        Builder b = builder();
        for (int v = 1; v <= n; ++v) b.proposition(Integer.toString(v));
        // proposition v has id v-1
        for (int d = 1; 1 + (j - 1) * d <= n; ++d) {
            for (int i = 1; i + (j - 1) * d <= n; ++i) {
                List<Literal> clause = new ArrayList<>(j);
                for (int h = 0; h < j; ++h) clause.add(Literal.of(i + d * h - 1));
                b.addClause(clause);
            }
        }
        for (int d = 1; 1 + (k - 1) * d <= n; ++d) {
            for (int i = 1; i + (k - 1) * d <= n; ++i) {
                List<Literal> clause = new ArrayList<>(k);
                for (int h = 0; h < k; ++h) clause.add(Literal.not(i + d * h - 1));
                b.addClause(clause);
            }
        }
        if (b.constraints.isEmpty()) throw new IllegalArgumentException("waerden(" + j + ", " + k + "; " + n + ") has no clauses");
        return b.build();
    }

    /**
     * Langford pairing as exact cover (7.2.2.2 (11)): one proposition per way of placing
     * digit d in positions p and p+d+1, named "d@p". Each digit and each of the 2n
     * positions must be covered by exactly one placement, which we state directly as a
     * [1,1] constraint rather than a positive clause plus pairwise exclusions.
     */
    public static Problem langford(int n) {
        if (n < 2) throw new IllegalArgumentException("langford needs n >= 2");
        Builder b = builder();
        List<List<Literal>> columns = new ArrayList<>(3 * n);
        for (int i = 0; i < 3 * n; ++i) columns.add(new ArrayList<>());
        for (int i = 0; i < n; ++i) {
            for (int j = 0; j + i + 2 < 2 * n; ++j) {
                Literal row = Literal.of(b.proposition((i + 1) + "@" + (j + 1)));
                columns.get(i).add(row);
                columns.get(n + j).add(row);
                columns.get(n + j + i + 2).add(row);
            }
        }
        for (List<Literal> c : columns) b.addConstraint(c, 1, 1);
        return b.build();
    }
}
