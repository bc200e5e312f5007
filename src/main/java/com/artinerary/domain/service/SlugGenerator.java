package com.artinerary.domain.service;

import cn.hutool.core.util.RandomUtil;
import com.artinerary.domain.config.EngageProperties;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;

/**
 * URL slugs: the slugified title plus a random lower-case suffix, e.g. {@code night-walk-x7k2p9qa}.
 */
@Component
public class SlugGenerator {

    static final int MAX_BASE_LENGTH = 100;

    private static final String SUFFIX_CHARS = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final EngageProperties props;

    public SlugGenerator(EngageProperties props) {
        this.props = props;
    }

    public String generate(String title) {
        int len = Math.max(4, props.getSlugSuffixLength());
        return slugify(title) + "-" + RandomUtil.randomString(SUFFIX_CHARS, len);
    }

    static String slugify(String title) {
        if (title == null) {
            return "event";
        }
        String s = Normalizer.normalize(title, Normalizer.Form.NFKD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+)|(-+$)", "");
        if (s.length() > MAX_BASE_LENGTH) {
            s = s.substring(0, MAX_BASE_LENGTH).replaceAll("-+$", "");
        }
        return s.isEmpty() ? "event" : s;
    }
}
