package com.tarterware.devicewatch.exceptions;

/**
 * Thrown when an ingested sample or a query is missing a required field.
 */
public class InvalidSampleException extends IllegalArgumentException
{
    private static final long serialVersionUID = 1L;

    public InvalidSampleException(String message)
    {
        super(message);
    }
}
