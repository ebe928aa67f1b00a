package com.deva.user_directory_service.model;

import com.fasterxml.jackson.annotation.JsonAlias;

public record User(
        @JsonAlias("UserName") String userName,
        @JsonAlias("UserAge") int userAge
) {}
