package com.pickshot.dto;

/**
 * Rename outcome; on success {@link #getPhoto()} is the record under its new
 * identity.
 */
public class RenameResult extends ActionResult {

    private PhotoRecord photo;

    public RenameResult() {
    }

    public RenameResult(boolean success, String message, PhotoRecord photo) {
        super(success, message);
        this.photo = photo;
    }

    public static RenameResult renamed(PhotoRecord photo) {
        return new RenameResult(true, null, photo);
    }

    public static RenameResult rejected(String message) {
        return new RenameResult(false, message, null);
    }

    public PhotoRecord getPhoto() {
        return photo;
    }

    public void setPhoto(PhotoRecord photo) {
        this.photo = photo;
    }
}
