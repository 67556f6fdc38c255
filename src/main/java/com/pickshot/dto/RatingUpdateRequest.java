package com.pickshot.dto;

public class RatingUpdateRequest {

    /** Photo id (absolute source path) */
    private String id;

    /** 0 clears the rating */
    private int rating;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public int getRating() {
        return rating;
    }

    public void setRating(int rating) {
        this.rating = rating;
    }
}
