package com.pickshot.dto;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of opening a directory: the photos found and the ratings already
 * known for them. Only ratings above zero are listed.
 */
public class PhotoCollection {

    private String directory;
    private List<PhotoRecord> photos;
    private Map<String, Integer> ratings;

    public PhotoCollection() {
    }

    public PhotoCollection(String directory, List<PhotoRecord> photos, Map<String, Integer> ratings) {
        this.directory = directory;
        this.photos = photos;
        this.ratings = ratings;
    }

    public static PhotoCollection empty() {
        return new PhotoCollection(null, Collections.emptyList(), Collections.emptyMap());
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public List<PhotoRecord> getPhotos() {
        return photos;
    }

    public void setPhotos(List<PhotoRecord> photos) {
        this.photos = photos;
    }

    public Map<String, Integer> getRatings() {
        return ratings;
    }

    public void setRatings(Map<String, Integer> ratings) {
        this.ratings = ratings;
    }
}
