package com.climaterisklens.auth;

/**
 * A message could not be handed to the mail server.
 */
public class MailDeliveryException extends Exception {

    public MailDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
