package com.dnobretech.leitorbackend.text;

import java.util.List;
import java.util.SortedSet;

public record LexicalIndex(
        List<TokenRange> sentences,
        SortedSet<String> uniqueWords,
        List<TokenRange> pages
) {}
