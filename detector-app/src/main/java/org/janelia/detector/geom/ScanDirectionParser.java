package org.janelia.detector.geom;

import java.util.ArrayList;
import java.util.List;

import org.janelia.detector.spec.Vector3D;

/**
 * Parses the algebraic direction syntax used for scan vectors, e.g. {@code +0.0024x -0.9999y}
 * or {@code -x}.  Whitespace is expected to have been removed from the value already.
 */
class ScanDirectionParser {

    private ScanDirectionParser() {
    }

    /**
     * @return vector with the components named in the specified value, unnamed components are zero.
     *
     * @throws IllegalArgumentException
     *   if the value is empty, names an unknown axis, or has a non-numeric coefficient.
     */
    static Vector3D parse(final String value)
            throws IllegalArgumentException {

        final List<String> terms = splitTerms(value);
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("invalid direction '" + value + "'");
        }

        double x = 0.0;
        double y = 0.0;
        double z = 0.0;

        for (final String term : terms) {

            final char axis = term.charAt(term.length() - 1);
            final String coefficientText = term.substring(0, term.length() - 1);

            final double coefficient;
            if ("+".equals(coefficientText)) {
                coefficient = 1.0;
            } else if ("-".equals(coefficientText)) {
                coefficient = -1.0;
            } else {
                try {
                    coefficient = Double.parseDouble(coefficientText);
                } catch (final NumberFormatException e) {
                    throw new IllegalArgumentException("invalid coefficient '" + coefficientText +
                                                       "' in direction '" + value + "'", e);
                }
            }

            switch (axis) {
                case 'x':
                    x = coefficient;
                    break;
                case 'y':
                    y = coefficient;
                    break;
                case 'z':
                    z = coefficient;
                    break;
                default:
                    throw new IllegalArgumentException("invalid symbol '" + axis +
                                                       "' in direction '" + value + "' (must be x, y or z)");
            }
        }

        return new Vector3D(x, y, z);
    }

    /**
     * Splits "0.5x-1y+z" into ["+0.5x", "-1y", "+z"].
     * Signs that follow an exponent marker (e.g. 1e-3x) stay with their term.
     */
    private static List<String> splitTerms(final String value) {
        final List<String> terms = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            final boolean isSign = (c == '+') || (c == '-');
            final boolean followsExponent = (i > 0) && (Character.toLowerCase(value.charAt(i - 1)) == 'e') &&
                                            (i > 1) && Character.isDigit(value.charAt(i - 2));
            if (isSign && (! followsExponent) && (current.length() > 0)) {
                terms.add(current.toString());
                current = new StringBuilder();
            }
            current.append(c);
        }
        if (current.length() > 0) {
            terms.add(current.toString());
        }

        final List<String> signedTerms = new ArrayList<>(terms.size());
        for (final String term : terms) {
            if ((term.charAt(0) == '+') || (term.charAt(0) == '-')) {
                signedTerms.add(term);
            } else {
                signedTerms.add("+" + term);
            }
        }
        return signedTerms;
    }
}
