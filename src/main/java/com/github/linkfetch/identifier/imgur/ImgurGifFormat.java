package com.github.linkfetch.identifier.imgur;

/**
 * Versions of an animated image that Imgur can serve.
 */
public enum ImgurGifFormat {

    /** GIF image (image/gif), served as the regular link */
    GIF("link"),
    /** Imgur's GIFV page */
    GIFV("gifv"),
    /** WebM video (video/webm) */
    WEBM("webm"),
    /** MP4 video (video/mp4) */
    MP4("mp4");

    private final String jsonName;

    ImgurGifFormat(String jsonName) {
        this.jsonName = jsonName;
    }

    /**
     * @return Name of the field holding this version in an Imgur image object
     */
    public String getJsonName() {
        return jsonName;
    }
}
