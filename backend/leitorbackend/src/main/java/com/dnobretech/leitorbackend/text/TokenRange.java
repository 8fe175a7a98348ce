package com.dnobretech.leitorbackend.text;

/** Intervalo semiaberto [start, end) de indices de token. */
public record TokenRange(int start, int end) {

    public TokenRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("intervalo invalido: [" + start + ", " + end + ")");
        }
    }

    public int size() {
        return end - start;
    }
}
