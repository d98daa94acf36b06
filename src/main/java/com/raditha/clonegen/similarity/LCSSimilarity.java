package com.raditha.clonegen.similarity;

import com.raditha.clonegen.model.Token;

import java.util.List;

/**
 * Similarity of two code-token sequences, measured as the length of their
 * longest common subsequence over the length of the longer sequence.
 * <p>
 * Tokens are compared with {@link Token#sameAs}: kind and text must agree,
 * source positions do not matter. An inserted statement therefore lowers the
 * score by roughly its share of the variant, while reformatting leaves it at 1.0.
 */
public class LCSSimilarity {

    /**
     * @return 1.0 for two empty sequences, 0.0 when exactly one is empty or
     *         either is null, otherwise {@code lcs / max(size1, size2)}
     */
    public double calculate(List<Token> original, List<Token> variant) {
        if (original == null || variant == null) {
            return 0.0;
        }
        int longest = Math.max(original.size(), variant.size());
        if (longest == 0) {
            return 1.0;
        }
        return (double) lcsLength(original, variant) / longest;
    }

    /**
     * Length of the longest common subsequence. Symmetric in its arguments.
     * Keeps a single row sized by the shorter sequence.
     */
    public int lcsLength(List<Token> first, List<Token> second) {
        List<Token> rows = first.size() <= second.size() ? first : second;
        List<Token> columns = rows == first ? second : first;
        if (rows.isEmpty()) {
            return 0;
        }

        int[] row = new int[rows.size() + 1];
        for (Token column : columns) {
            int diagonal = 0;
            for (int i = 1; i <= rows.size(); i++) {
                int above = row[i];
                row[i] = rows.get(i - 1).sameAs(column)
                        ? diagonal + 1
                        : Math.max(row[i - 1], above);
                diagonal = above;
            }
        }
        return row[rows.size()];
    }
}
