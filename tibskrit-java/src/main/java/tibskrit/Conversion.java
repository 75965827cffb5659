package tibskrit;

/**
 * IAST output of one conversion with the structural validity of its input.
 */
public final class Conversion {

    private final String output;
    private final boolean valid;

    Conversion(String output, boolean valid) {
        this.output = output;
        this.valid = valid;
    }

    public String getOutput() {
        return output;
    }

    /**
     * False when the input had combining marks without a base consonant.
     */
    public boolean isValid() {
        return valid;
    }

    @Override
    public String toString() {
        return output;
    }
}
