package com.solusoft.ai.claimmatch.features.assignments;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.springframework.stereotype.Component;

import com.solusoft.ai.claimmatch.features.documents.model.CalendarAttendee;
import com.solusoft.ai.claimmatch.features.documents.model.DocumentSourceType;
import com.solusoft.ai.claimmatch.features.documents.model.MedicalDocument;
import com.solusoft.ai.claimmatch.features.illnesses.model.AccountRole;
import com.solusoft.ai.claimmatch.features.illnesses.model.RelevantAccount;

/**
 * Collects the provider, pharmacy, lab and insurer addresses a document was exchanged with.
 * Personal mailbox domains are never returned.
 */
@Component
public class AccountExtractor {

    private static final Pattern NAMED_ADDRESS = Pattern.compile("^(.+?)\\s*<(.+)>$");

    private static final Set<String> PERSONAL_DOMAINS = Set.of(
            "gmail.com", "googlemail.com", "yahoo.com", "yahoo.co.uk", "hotmail.com", "outlook.com",
            "live.com", "msn.com", "aol.com", "icloud.com", "me.com", "mac.com", "protonmail.com",
            "proton.me", "mail.com", "inbox.com", "zoho.com", "yandex.com", "gmx.com", "gmx.de",
            "web.de", "t-online.de", "freenet.de");

    // Checked in declaration order, most specific first
    private static final Map<AccountRole, List<Pattern>> ROLE_PATTERNS = new LinkedHashMap<>();

    static {
        ROLE_PATTERNS.put(AccountRole.PHARMACY, patterns(
                "pharmacy", "apothecary", "apotheke", "farmacia", "rx", "drug", "med(s|ication)?store",
                "walgreen", "cvs", "boots"));
        ROLE_PATTERNS.put(AccountRole.LAB, patterns(
                "lab", "laboratory", "diagnostic", "pathology", "test", "analysis", "quest", "labcorp"));
        ROLE_PATTERNS.put(AccountRole.INSURANCE, patterns(
                "insurance", "cigna", "aetna", "anthem", "united.*health", "humana", "kaiser",
                "blue.*cross", "blue.*shield", "assurance", "versicherung"));
        ROLE_PATTERNS.put(AccountRole.PROVIDER, patterns(
                "hospital", "clinic", "medical", "health", "care", "doctor", "dr\\.", "nhs", "therapy",
                "psycho", "dentist", "dental", "ortho", "physio", "chiro", "optic", "eye", "vision"));
    }

    private final Clock clock;

    public AccountExtractor(Clock clock) {
        this.clock = clock;
    }

    public List<RelevantAccount> extract(MedicalDocument document) {
        Map<String, RelevantAccount> accounts = new LinkedHashMap<>();
        Instant now = Instant.now(clock);

        if ((document.sourceType() == DocumentSourceType.EMAIL || document.sourceType() == DocumentSourceType.ATTACHMENT)
                && document.fromAddress() != null) {
            Matcher matcher = NAMED_ADDRESS.matcher(document.fromAddress());
            if (matcher.matches()) {
                add(accounts, matcher.group(2), matcher.group(1).trim(), document.id(), now);
            } else {
                add(accounts, document.fromAddress(), null, document.id(), now);
            }
        }

        if (document.isCalendarEvent()) {
            if (document.calendarOrganizer() != null && document.calendarOrganizer().email() != null) {
                add(accounts, document.calendarOrganizer().email(), document.calendarOrganizer().displayName(), document.id(), now);
            }
            for (CalendarAttendee attendee : document.calendarAttendees()) {
                if (attendee.organizer() || "declined".equals(attendee.response()) || attendee.email() == null) {
                    continue;
                }
                add(accounts, attendee.email(), attendee.name(), document.id(), now);
            }
        }

        return new ArrayList<>(accounts.values());
    }

    static AccountRole inferRole(String email, String name) {
        int at = email.indexOf('@');
        String domain = at >= 0 ? email.substring(at + 1) : "";
        String text = (domain + " " + (name != null ? name : "")).toLowerCase(Locale.ROOT);

        return ROLE_PATTERNS.entrySet().stream()
                .filter(e -> e.getValue().stream().anyMatch(p -> p.matcher(text).find()))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(AccountRole.OTHER);
    }

    private void add(Map<String, RelevantAccount> accounts, String email, String name, String documentId, Instant now) {
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty() || !normalized.contains("@") || isPersonal(normalized) || accounts.containsKey(normalized)) {
            return;
        }
        String trimmedName = name != null && !name.isBlank() ? name.trim() : null;
        accounts.put(normalized, RelevantAccount.builder()
                .email(normalized)
                .name(trimmedName)
                .role(inferRole(normalized, name))
                .addedAt(now)
                .sourceDocumentId(documentId)
                .build());
    }

    private static boolean isPersonal(String email) {
        return PERSONAL_DOMAINS.contains(email.substring(email.indexOf('@') + 1));
    }

    private static List<Pattern> patterns(String... regexes) {
        return Stream.of(regexes).map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE)).toList();
    }
}
