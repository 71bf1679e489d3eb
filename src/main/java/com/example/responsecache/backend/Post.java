package com.example.responsecache.backend;

public class Post {

    private final int id;
    private final String title;
    private final String content;
    private final int userId;

    public Post(int id, String title, String content, int userId) {
        this.id = id;
        this.title = title;
        this.content = content;
        this.userId = userId;
    }

    public int getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getContent() {
        return content;
    }

    public int getUserId() {
        return userId;
    }
}
