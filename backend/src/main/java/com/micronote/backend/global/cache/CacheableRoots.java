package com.micronote.backend.global.cache;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.stereotype.Component;
import org.springframework.web.util.UrlPathHelper;

/**
 * Resolves which configured cache root, if any, a request belongs to.
 */
@Component
public class CacheableRoots {

    private final List<String> roots;
    private final String accountRoot;

    public CacheableRoots(CacheProperties properties) {
        // longest first so nested roots win over their parents
        this.roots = properties.getPaths().stream()
                .map(CacheableRoots::stripTrailingSlash)
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
        this.accountRoot = stripTrailingSlash(properties.getAccountRoot());
    }

    public Optional<String> match(String path) {
        if (path == null) {
            return Optional.empty();
        }
        return roots.stream()
                .filter(root -> path.equals(root) || path.startsWith(root + "/"))
                .findFirst();
    }

    public boolean isAccountRoot(String root) {
        return accountRoot.equals(root);
    }

    public static String pathOf(HttpServletRequest request) {
        return UrlPathHelper.defaultInstance.getPathWithinApplication(request);
    }

    private static String stripTrailingSlash(String path) {
        if (path.length() > 1 && path.endsWith("/")) {
            return path.substring(0, path.length() - 1);
        }
        return path;
    }
}
