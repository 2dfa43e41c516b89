package com.hcltech.frolyk.consumer.offset;

/** The value given to a commit cannot be read as a non-negative offset. */
public class InvalidOffsetException extends IllegalArgumentException {
    public InvalidOffsetException(String message) {
        super(message);
    }
}
