package com.ruian.runner;

import com.ruian.service.UserAccountService;
import com.ruian.service.UserAccountService.CreateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Provisions user accounts from start-up options:
 * <pre>
 * java -jar ruian-backend.jar --import-users=users.csv
 * java -jar ruian-backend.jar --username=admin --password=secret123
 * java -jar ruian-backend.jar --username=admin --password=newsecret --reset-password
 * </pre>
 *
 * The CSV file needs a header row with "username" and "password" columns.
 * Rows with a blank field are skipped. Existing users are skipped too, unless
 * --no-skip-existing is given, in which case they count as failures. Each
 * user is created in its own transaction so one bad row does not undo the
 * others.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class UserImportRunner implements ApplicationRunner {

    static final String FILE_OPTION = "import-users";
    static final String USERNAME_OPTION = "username";
    static final String PASSWORD_OPTION = "password";
    static final String NO_SKIP_EXISTING_OPTION = "no-skip-existing";
    static final String RESET_PASSWORD_OPTION = "reset-password";

    private final UserAccountService userAccountService;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        boolean fromFile = args.containsOption(FILE_OPTION);
        boolean singleUser = args.containsOption(USERNAME_OPTION);
        if (!fromFile && !singleUser) {
            return;
        }
        if (fromFile && singleUser) {
            throw new IllegalArgumentException(
                    "--" + FILE_OPTION + " and --" + USERNAME_OPTION + " cannot be used together");
        }

        boolean skipExisting = !args.containsOption(NO_SKIP_EXISTING_OPTION);
        if (fromFile) {
            importFile(Path.of(requireValue(args, FILE_OPTION).trim()), skipExisting);
            return;
        }

        String username = requireValue(args, USERNAME_OPTION);
        String password = requireValue(args, PASSWORD_OPTION);
        if (args.containsOption(RESET_PASSWORD_OPTION)) {
            userAccountService.changePassword(username, password);
        } else {
            CreateResult result = userAccountService.createUser(username, password, skipExisting);
            log.info("User {}: {}", username, result == CreateResult.CREATED ? "created" : "already exists, skipped");
        }
    }

    private static String requireValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new IllegalArgumentException("--" + option + " requires a value");
        }
        return values.get(0);
    }

    /**
     * Import every row of a users CSV file.
     *
     * @param file the CSV file
     * @param skipExisting skip existing users instead of counting them as failures
     * @return created, skipped and failed counts
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the header lacks a required column
     */
    public ImportCounts importFile(Path file, boolean skipExisting) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("User file does not exist: " + file);
        }
        log.info("Importing users from {}", file);

        ImportCounts counts = new ImportCounts();
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreHeaderCase(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();

        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, format)) {

            if (!parser.getHeaderMap().containsKey("username") || !parser.getHeaderMap().containsKey("password")) {
                throw new IllegalArgumentException("CSV header must contain 'username' and 'password' columns");
            }

            for (CSVRecord record : parser) {
                long rowNumber = record.getRecordNumber() + 1;
                String username = record.isSet("username") ? record.get("username") : "";
                String password = record.isSet("password") ? record.get("password") : "";

                if (username.isEmpty() || password.isEmpty()) {
                    log.warn("Row {}: username or password is empty, skipped", rowNumber);
                    counts.skipped++;
                    continue;
                }

                try {
                    CreateResult result = userAccountService.createUser(username, password, skipExisting);
                    if (result == CreateResult.CREATED) {
                        counts.created++;
                    } else {
                        counts.skipped++;
                    }
                } catch (IllegalArgumentException e) {
                    log.warn("Row {}: {}", rowNumber, e.getMessage());
                    counts.failed++;
                }
            }
        }

        log.info("User import finished: created={}, skipped={}, failed={}",
                counts.created, counts.skipped, counts.failed);
        return counts;
    }

    public static class ImportCounts {
        int created;
        int skipped;
        int failed;

        public int getCreated() {
            return created;
        }

        public int getSkipped() {
            return skipped;
        }

        public int getFailed() {
            return failed;
        }
    }
}
