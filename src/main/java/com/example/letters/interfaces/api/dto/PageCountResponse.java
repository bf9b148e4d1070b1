package com.example.letters.interfaces.api.dto;

public record PageCountResponse(int pageCount) {
}
