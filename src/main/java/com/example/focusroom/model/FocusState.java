package com.example.focusroom.model;

public enum FocusState {
    FOCUSED,
    DISTRACTED
}
