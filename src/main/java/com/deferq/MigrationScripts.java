package com.deferq;

import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Versioned SQL scripts named {@code V<version>__<description>.sql}, sorted by
 * version. Scripts may use the {@code {jobs_table}} and {@code {table_prefix}}
 * placeholders.
 */
final class MigrationScripts {

    static final String DEFAULT_LOCATION = "classpath*:deferq/migration/V*__*.sql";

    private static final Pattern FILE_NAME = Pattern.compile("^V(\\d+(?:_\\d+)*)__([A-Za-z0-9_\\-]+)\\.sql$");

    private MigrationScripts() {
    }

    static List<Script> load(String location) throws IOException {
        return load(new PathMatchingResourcePatternResolver(), location);
    }

    static List<Script> load(ResourcePatternResolver resolver, String location) throws IOException {
        List<Script> scripts = new ArrayList<>();
        for (Resource resource : resolver.getResources(location)) {
            String fileName = resource.getFilename();
            if (fileName == null) {
                continue;
            }
            Matcher matcher = FILE_NAME.matcher(fileName);
            if (!matcher.matches()) {
                throw new IllegalStateException("Invalid DeferQ migration filename '" + fileName
                        + "'. Expected V{version}__{description}.sql");
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            scripts.add(new Script(
                    matcher.group(1),
                    matcher.group(2).replace('_', ' '),
                    fileName,
                    sql,
                    sha256(sql)));
        }
        scripts.sort(Script::compareTo);

        for (int i = 1; i < scripts.size(); i++) {
            Script previous = scripts.get(i - 1);
            Script current = scripts.get(i);
            if (previous.compareTo(current) == 0) {
                throw new IllegalStateException("Duplicate DeferQ migration version V" + current.version()
                        + " in files " + previous.fileName() + " and " + current.fileName());
            }
        }
        return scripts;
    }

    static String render(String sql, String jobsTable, String tablePrefix) {
        return sql.replace("{jobs_table}", jobsTable).replace("{table_prefix}", tablePrefix);
    }

    private static String sha256(String sql) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(sql.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    record Script(String version, String description, String fileName, String sql, String checksum)
            implements Comparable<Script> {

        int[] versionParts() {
            return Arrays.stream(version.split("_")).mapToInt(Integer::parseInt).toArray();
        }

        @Override
        public int compareTo(Script other) {
            int[] left = versionParts();
            int[] right = other.versionParts();
            for (int i = 0; i < Math.max(left.length, right.length); i++) {
                int l = i < left.length ? left[i] : 0;
                int r = i < right.length ? right[i] : 0;
                if (l != r) {
                    return Integer.compare(l, r);
                }
            }
            return 0;
        }
    }
}
