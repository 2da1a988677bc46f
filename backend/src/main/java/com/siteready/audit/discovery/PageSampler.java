package com.siteready.audit.discovery;

import com.siteready.audit.util.UrlUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;

@Component
public class PageSampler {
    private final Random random;

    public PageSampler() {
        this(new Random());
    }

    PageSampler(Random random) {
        this.random = random;
    }

    /**
     * @return the seed followed by at most {@code maxPages - 1} distinct candidates
     */
    public List<String> sample(List<String> candidates, String seedUrl, int maxPages) {
        List<String> selected = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        selected.add(seedUrl);
        seen.add(UrlUtils.normalize(seedUrl));
        if (maxPages <= 1) {
            return selected;
        }

        Map<String, List<String>> grouped = new TreeMap<>();
        for (String url : candidates) {
            if (seen.contains(UrlUtils.normalize(url))) {
                continue;
            }
            grouped.computeIfAbsent(UrlUtils.firstPathSegment(url), ignored -> new ArrayList<>()).add(url);
        }

        List<Deque<String>> groups = new ArrayList<>();
        for (List<String> urls : grouped.values()) {
            Collections.shuffle(urls, random);
            groups.add(new ArrayDeque<>(urls));
        }

        int index = 0;
        while (selected.size() < maxPages && !groups.isEmpty()) {
            Deque<String> group = groups.get(index);
            String url = group.pollFirst();
            if (url != null && seen.add(UrlUtils.normalize(url))) {
                selected.add(url);
            }
            if (group.isEmpty()) {
                groups.remove(index);
                if (groups.isEmpty()) {
                    break;
                }
                index = index % groups.size();
            } else {
                index = (index + 1) % groups.size();
            }
        }
        return selected;
    }
}
