package com.triagesentinel.analyzer.executable;

/**
 * The bytes are not a well-formed PE image. Never fatal to an artifact: the
 * caller simply attaches no executable facts.
 *
 * @author Naveed Gung
 */
public class PeFormatException extends Exception {

    public PeFormatException(String message) {
        super(message);
    }
}
