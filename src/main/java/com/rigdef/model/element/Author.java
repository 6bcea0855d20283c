package com.rigdef.model.element;

import lombok.Data;

@Data
public class Author {
    private String type = "";
    private int forumAccountId;
    private boolean forumAccountSet;
    private String name = "";
    private String email = "";
}
