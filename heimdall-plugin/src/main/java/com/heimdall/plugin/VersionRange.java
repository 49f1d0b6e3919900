package com.heimdall.plugin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Accepted versions of a dependency.
 * <ul>
 *   <li>{@code *} or empty: any version</li>
 *   <li>{@code 1.2.3}: exactly that version</li>
 *   <li>{@code >=1.0.0 <2.0.0}: all comparators must hold ({@code >}, {@code >=}, {@code <}, {@code <=}, {@code =})</li>
 *   <li>{@code ^1.2.0}: same major ({@code >=1.2.0 <2.0.0}); for {@code ^0.x} same minor</li>
 *   <li>{@code ~1.2.0}: same minor ({@code >=1.2.0 <1.3.0})</li>
 * </ul>
 */
public final class VersionRange {

    private enum Op { EQ, GT, GE, LT, LE }

    private record Constraint(Op op, SemanticVersion version) {
        boolean test(SemanticVersion v) {
            int c = v.compareTo(version);
            switch (op) {
                case EQ: return c == 0;
                case GT: return c > 0;
                case GE: return c >= 0;
                case LT: return c < 0;
                default: return c <= 0;
            }
        }
    }

    public static final VersionRange ANY = new VersionRange("*", List.of());

    private final String text;
    private final List<Constraint> constraints;

    private VersionRange(String text, List<Constraint> constraints) {
        this.text = text;
        this.constraints = constraints;
    }

    /**
     * @throws IllegalArgumentException when the range or one of its versions cannot be parsed
     */
    public static VersionRange parse(String text) {
        if (text == null || text.isBlank() || "*".equals(text.trim())) {
            return ANY;
        }
        String trimmed = text.trim();
        List<Constraint> constraints = new ArrayList<>();
        for (String token : trimmed.split("\\s+")) {
            addConstraints(token, constraints);
        }
        return new VersionRange(trimmed, Collections.unmodifiableList(constraints));
    }

    private static void addConstraints(String token, List<Constraint> out) {
        if (token.startsWith("^")) {
            SemanticVersion base = SemanticVersion.parse(token.substring(1));
            SemanticVersion upper = base.major() > 0
                    ? SemanticVersion.of(base.major() + 1, 0, 0)
                    : SemanticVersion.of(0, base.minor() + 1, 0);
            out.add(new Constraint(Op.GE, base));
            out.add(new Constraint(Op.LT, upper));
        } else if (token.startsWith("~")) {
            SemanticVersion base = SemanticVersion.parse(token.substring(1));
            out.add(new Constraint(Op.GE, base));
            out.add(new Constraint(Op.LT, SemanticVersion.of(base.major(), base.minor() + 1, 0)));
        } else if (token.startsWith(">=")) {
            out.add(new Constraint(Op.GE, SemanticVersion.parse(token.substring(2))));
        } else if (token.startsWith("<=")) {
            out.add(new Constraint(Op.LE, SemanticVersion.parse(token.substring(2))));
        } else if (token.startsWith(">")) {
            out.add(new Constraint(Op.GT, SemanticVersion.parse(token.substring(1))));
        } else if (token.startsWith("<")) {
            out.add(new Constraint(Op.LT, SemanticVersion.parse(token.substring(1))));
        } else if (token.startsWith("=")) {
            out.add(new Constraint(Op.EQ, SemanticVersion.parse(token.substring(1))));
        } else {
            out.add(new Constraint(Op.EQ, SemanticVersion.parse(token)));
        }
    }

    public boolean matches(SemanticVersion version) {
        Objects.requireNonNull(version, "version");
        for (Constraint c : constraints) {
            if (!c.test(version)) return false;
        }
        return true;
    }

    public boolean isAny() {
        return constraints.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VersionRange other && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
