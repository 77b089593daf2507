package com.viffx.CompilerGen;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Settings shared by the scanner, the grammar normalizer and the translator.
 * <p>
 * Token-type sets refine how production shapes are recognized: a terminal listed in
 * {@code nonOperatorTokens} never acts as a binary operator, a terminal listed in
 * {@code loopKeywords} turns a guarded alternative into a loop, and so on.
 * {@code requireExplicitDeclaration} is {@code null} when it should be inferred from the grammar.
 */
public record GeneratorConfig(
        Set<String> skipTokens,
        boolean implicitWhitespace,
        String identifierToken,
        Set<String> loopKeywords,
        Set<String> elseKeywords,
        Set<String> inputKeywords,
        Set<String> declarationKeywords,
        Set<String> nonOperatorTokens,
        Set<String> assignmentTokens,
        Boolean requireExplicitDeclaration,
        boolean semanticChecks,
        boolean leftFactoring,
        boolean retainTree,
        String tempPrefix,
        String labelPrefix,
        int maxDfaStates,
        int suggestionDistance
) {
    public static final String RESOURCE = "/compilergen.properties";

    public GeneratorConfig {
        skipTokens = Set.copyOf(skipTokens);
        loopKeywords = Set.copyOf(loopKeywords);
        elseKeywords = Set.copyOf(elseKeywords);
        inputKeywords = Set.copyOf(inputKeywords);
        declarationKeywords = Set.copyOf(declarationKeywords);
        nonOperatorTokens = Set.copyOf(nonOperatorTokens);
        assignmentTokens = Set.copyOf(assignmentTokens);
        if (maxDfaStates <= 0) throw new IllegalArgumentException("maxDfaStates must be positive: " + maxDfaStates);
        if (suggestionDistance < 0) throw new IllegalArgumentException("suggestionDistance cannot be negative: " + suggestionDistance);
        if (tempPrefix.isEmpty() || labelPrefix.isEmpty()) throw new IllegalArgumentException("temporary and label prefixes cannot be empty");
    }

    /**
     * Returns the defaults shipped in {@code compilergen.properties}.
     */
    @NotNull
    public static GeneratorConfig defaults() {
        return Holder.DEFAULTS;
    }

    @NotNull
    @Contract(" -> new")
    public static Builder builder() {
        return new Builder();
    }

    @NotNull
    @Contract(" -> new")
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.skipTokens = skipTokens;
        builder.implicitWhitespace = implicitWhitespace;
        builder.identifierToken = identifierToken;
        builder.loopKeywords = loopKeywords;
        builder.elseKeywords = elseKeywords;
        builder.inputKeywords = inputKeywords;
        builder.declarationKeywords = declarationKeywords;
        builder.nonOperatorTokens = nonOperatorTokens;
        builder.assignmentTokens = assignmentTokens;
        builder.requireExplicitDeclaration = requireExplicitDeclaration;
        builder.semanticChecks = semanticChecks;
        builder.leftFactoring = leftFactoring;
        builder.retainTree = retainTree;
        builder.tempPrefix = tempPrefix;
        builder.labelPrefix = labelPrefix;
        builder.maxDfaStates = maxDfaStates;
        builder.suggestionDistance = suggestionDistance;
        return builder;
    }

    /**
     * Loads a configuration from properties. Keys that are absent keep their built-in values.
     *
     * @param properties the properties to read
     * @return the resulting configuration
     * @throws IllegalArgumentException if a numeric or boolean value cannot be parsed
     */
    @NotNull
    public static GeneratorConfig fromProperties(@NotNull Properties properties) {
        Builder builder = new Builder();
        String value;
        if ((value = properties.getProperty("scanner.skipTokens")) != null) builder.skipTokens(split(value));
        if ((value = properties.getProperty("scanner.implicitWhitespace")) != null) builder.implicitWhitespace(bool("scanner.implicitWhitespace", value));
        if ((value = properties.getProperty("scanner.maxDfaStates")) != null) builder.maxDfaStates(integer("scanner.maxDfaStates", value));
        if ((value = properties.getProperty("grammar.leftFactoring")) != null) builder.leftFactoring(bool("grammar.leftFactoring", value));
        if ((value = properties.getProperty("tokens.identifier")) != null) builder.identifierToken(value.trim());
        if ((value = properties.getProperty("tokens.loopKeywords")) != null) builder.loopKeywords(split(value));
        if ((value = properties.getProperty("tokens.elseKeywords")) != null) builder.elseKeywords(split(value));
        if ((value = properties.getProperty("tokens.inputKeywords")) != null) builder.inputKeywords(split(value));
        if ((value = properties.getProperty("tokens.declarationKeywords")) != null) builder.declarationKeywords(split(value));
        if ((value = properties.getProperty("tokens.nonOperators")) != null) builder.nonOperatorTokens(split(value));
        if ((value = properties.getProperty("tokens.assignments")) != null) builder.assignmentTokens(split(value));
        if ((value = properties.getProperty("semantics.checks")) != null) builder.semanticChecks(bool("semantics.checks", value));
        if ((value = properties.getProperty("semantics.explicitDeclaration")) != null) {
            builder.requireExplicitDeclaration(value.trim().equalsIgnoreCase("auto") ? null : bool("semantics.explicitDeclaration", value));
        }
        if ((value = properties.getProperty("semantics.suggestionDistance")) != null) builder.suggestionDistance(integer("semantics.suggestionDistance", value));
        if ((value = properties.getProperty("translation.retainTree")) != null) builder.retainTree(bool("translation.retainTree", value));
        if ((value = properties.getProperty("translation.tempPrefix")) != null) builder.tempPrefix(value.trim());
        if ((value = properties.getProperty("translation.labelPrefix")) != null) builder.labelPrefix(value.trim());
        return builder.build();
    }

    /**
     * Loads a configuration from a classpath resource.
     *
     * @throws IllegalArgumentException if the resource does not exist
     * @throws UncheckedIOException if the resource cannot be read
     */
    @NotNull
    public static GeneratorConfig load(@NotNull String resource) {
        try (InputStream in = GeneratorConfig.class.getResourceAsStream(resource)) {
            if (in == null) throw new IllegalArgumentException("Configuration resource not found: " + resource);
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read configuration resource " + resource, e);
        }
    }

    public boolean isOperatorToken(String tokenType) {
        return !nonOperatorTokens.contains(tokenType) &&
                !assignmentTokens.contains(tokenType) &&
                !tokenType.equals(identifierToken) &&
                !loopKeywords.contains(tokenType) &&
                !elseKeywords.contains(tokenType) &&
                !inputKeywords.contains(tokenType) &&
                !declarationKeywords.contains(tokenType);
    }

    private static Set<String> split(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static boolean bool(String key, String value) {
        String v = value.trim().toLowerCase();
        if (v.equals("true")) return true;
        if (v.equals("false")) return false;
        throw new IllegalArgumentException("Property " + key + " must be true or false, got: " + value);
    }

    private static int integer(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " must be an integer, got: " + value, e);
        }
    }

    private static final class Holder {
        private static final GeneratorConfig DEFAULTS = load(RESOURCE);
    }

    public static final class Builder {
        private Set<String> skipTokens = Set.of("WS", "WHITESPACE", "COMMENT", "SKIP");
        private boolean implicitWhitespace = true;
        private String identifierToken = "ID";
        private Set<String> loopKeywords = Set.of("WHILE");
        private Set<String> elseKeywords = Set.of("ELSE");
        private Set<String> inputKeywords = Set.of("READ");
        private Set<String> declarationKeywords = Set.of("VAR");
        private Set<String> nonOperatorTokens = Set.of("ID", "NUM", "LPAREN", "RPAREN", "SEMI", "ASSIGN", "COMMA",
                "LBRACE", "RBRACE", "BEGIN", "END", "VAR", "CONST", "PROCEDURE", "CALL");
        private Set<String> assignmentTokens = Set.of("ASSIGN", "BECOMES");
        private Boolean requireExplicitDeclaration = null;
        private boolean semanticChecks = true;
        private boolean leftFactoring = true;
        private boolean retainTree = false;
        private String tempPrefix = "t";
        private String labelPrefix = "L";
        private int maxDfaStates = 10000;
        private int suggestionDistance = 2;

        private Builder() {}

        public Builder skipTokens(Set<String> skipTokens) {
            this.skipTokens = skipTokens;
            return this;
        }

        public Builder implicitWhitespace(boolean implicitWhitespace) {
            this.implicitWhitespace = implicitWhitespace;
            return this;
        }

        public Builder identifierToken(String identifierToken) {
            this.identifierToken = identifierToken;
            return this;
        }

        public Builder loopKeywords(Set<String> loopKeywords) {
            this.loopKeywords = loopKeywords;
            return this;
        }

        public Builder elseKeywords(Set<String> elseKeywords) {
            this.elseKeywords = elseKeywords;
            return this;
        }

        public Builder inputKeywords(Set<String> inputKeywords) {
            this.inputKeywords = inputKeywords;
            return this;
        }

        public Builder declarationKeywords(Set<String> declarationKeywords) {
            this.declarationKeywords = declarationKeywords;
            return this;
        }

        public Builder nonOperatorTokens(Set<String> nonOperatorTokens) {
            this.nonOperatorTokens = nonOperatorTokens;
            return this;
        }

        public Builder assignmentTokens(Set<String> assignmentTokens) {
            this.assignmentTokens = assignmentTokens;
            return this;
        }

        public Builder requireExplicitDeclaration(Boolean requireExplicitDeclaration) {
            this.requireExplicitDeclaration = requireExplicitDeclaration;
            return this;
        }

        public Builder semanticChecks(boolean semanticChecks) {
            this.semanticChecks = semanticChecks;
            return this;
        }

        public Builder leftFactoring(boolean leftFactoring) {
            this.leftFactoring = leftFactoring;
            return this;
        }

        public Builder retainTree(boolean retainTree) {
            this.retainTree = retainTree;
            return this;
        }

        public Builder tempPrefix(String tempPrefix) {
            this.tempPrefix = tempPrefix;
            return this;
        }

        public Builder labelPrefix(String labelPrefix) {
            this.labelPrefix = labelPrefix;
            return this;
        }

        public Builder maxDfaStates(int maxDfaStates) {
            this.maxDfaStates = maxDfaStates;
            return this;
        }

        public Builder suggestionDistance(int suggestionDistance) {
            this.suggestionDistance = suggestionDistance;
            return this;
        }

        @NotNull
        public GeneratorConfig build() {
            return new GeneratorConfig(skipTokens, implicitWhitespace, identifierToken, loopKeywords, elseKeywords,
                    inputKeywords, declarationKeywords, nonOperatorTokens, assignmentTokens, requireExplicitDeclaration, semanticChecks,
                    leftFactoring, retainTree, tempPrefix, labelPrefix, maxDfaStates, suggestionDistance);
        }
    }
}
