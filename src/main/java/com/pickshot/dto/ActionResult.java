package com.pickshot.dto;

/**
 * Outcome of a user action on a photo. Failures carry a readable message
 * instead of an exception.
 */
public class ActionResult {

    private boolean success;
    private String message;

    public ActionResult() {
    }

    public ActionResult(boolean success, String message) {
        this.success = success;
        this.message = message;
    }

    public static ActionResult ok() {
        return new ActionResult(true, null);
    }

    public static ActionResult failure(String message) {
        return new ActionResult(false, message);
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
