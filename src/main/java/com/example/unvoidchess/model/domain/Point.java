package com.example.unvoidchess.model.domain;

public record Point(int r, int c) {
}
