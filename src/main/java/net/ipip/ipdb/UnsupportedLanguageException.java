package net.ipip.ipdb;

/**
 * Signals that the database carries no fields for the requested language.
 */
public class UnsupportedLanguageException extends LookupException {

    private static final long serialVersionUID = 1L;

    private final String language;

    UnsupportedLanguageException(String language) {
        super("The database does not support the language " + language);
        this.language = language;
    }

    /**
     * @return the requested language code
     */
    public String getLanguage() {
        return language;
    }
}
