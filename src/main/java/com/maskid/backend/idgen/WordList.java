package com.maskid.backend.idgen;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** alias 用的單字表（classpath:words.txt，一行一字） */
@Component
public class WordList {

    static final String RESOURCE = "words.txt";

    private final List<String> words;

    public WordList() {
        this(load(RESOURCE));
    }

    public WordList(List<String> words) {
        if (words == null || words.isEmpty()) throw new IllegalStateException("WORD_LIST_EMPTY");
        this.words = List.copyOf(words);
    }

    public String randomPair() {
        return pick() + "_" + pick();
    }

    public int size() {
        return words.size();
    }

    private String pick() {
        return words.get(RandomStrings.nextInt(words.size()));
    }

    private static List<String> load(String resource) {
        List<String> out = new ArrayList<>();
        try (var in = new ClassPathResource(resource).getInputStream();
             var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String w = line.trim().toLowerCase(Locale.ROOT);
                if (!w.isEmpty() && !w.startsWith("#") && w.matches("[a-z]+")) out.add(w);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to load " + resource, e);
        }
        return out;
    }
}
