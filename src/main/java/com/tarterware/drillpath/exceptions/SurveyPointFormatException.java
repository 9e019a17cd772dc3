package com.tarterware.drillpath.exceptions;

/**
 * Thrown when survey point text is not of the form {@code major+minor} with two
 * numeric parts.
 */
public class SurveyPointFormatException extends IllegalArgumentException
{
    private static final long serialVersionUID = 1L;

    private final String text;

    public SurveyPointFormatException(String text, String message)
    {
        super(message);
        this.text = text;
    }

    public SurveyPointFormatException(String text, String message, Throwable cause)
    {
        super(message, cause);
        this.text = text;
    }

    /**
     * @return the text that failed to parse.
     */
    public String getText()
    {
        return text;
    }
}
