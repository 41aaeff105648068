package io.taskqueue.wellness.notification;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Renders the subject, HTML and plain-text bodies for each {@link NotificationType}.
 *
 * <p>Values from the payload are HTML-escaped in the HTML body. Every message is tagged
 * with {@code notification-type} and {@code notification-channel}.
 */
public final class NotificationTemplates {

  public static final String DEFAULT_LOGIN_URL = "https://app.wellness.local/login";
  public static final String DEFAULT_SUPPORT_EMAIL = "support@wellness.local";
  public static final String DEFAULT_COMMUNITY_URL = "https://app.wellness.local/community";

  private static final Map<String, String> STREAK_LABELS = Map.of(
      "INSIGHTS", "insight",
      "LOGGING", "logging",
      "COMMUNITY", "community");

  private final DateTimeFormatter eventTimeFormat;

  public NotificationTemplates() {
    this(ZoneOffset.UTC);
  }

  /**
   * @param eventZone zone used to print community event start times
   */
  public NotificationTemplates(ZoneId eventZone) {
    this.eventTimeFormat = DateTimeFormatter.ofPattern("MMM d, h:mm a", Locale.US)
        .withZone(Objects.requireNonNull(eventZone, "eventZone"));
  }

  public EmailMessage render(NotificationPayload payload) {
    Content content = switch (payload.type()) {
      case INSIGHT_ALERT -> insightAlert(payload);
      case STREAK_NUDGE -> streakNudge(payload);
      case MODERATION_NOTICE -> moderationNotice(payload);
      case ONBOARDING_WELCOME -> onboardingWelcome(payload);
      case COMMUNITY_EVENT -> communityEvent(payload);
    };
    return new EmailMessage(payload.recipient().email(), content.subject(), content.html(), content.text(),
        List.of(new EmailMessage.Tag("notification-type", payload.type().name()),
            new EmailMessage.Tag("notification-channel", payload.channel())));
  }

  static String normalizeName(String displayName) {
    return displayName != null && !displayName.isBlank() ? displayName.trim() : "there";
  }

  private Content insightAlert(NotificationPayload payload) {
    String name = normalizeName(payload.recipient().displayName());
    String title = orEmpty(payload.dataText("insightTitle"));
    String summary = payload.dataText("summary");
    return new Content(
        "New insight: " + title,
        html(
            "<p>Hi " + escape(name) + ",</p>",
            "<p>Your latest insight <strong>" + escape(title) + "</strong> just landed.</p>",
            summary != null ? "<p>" + escape(summary) + "</p>" : "",
            "<p>Open your dashboard to review the full recommendation set and keep your streak alive.</p>",
            "<p>Your coaching team</p>"),
        text(
            "Hi " + name + ",",
            "",
            "Your latest insight \"" + title + "\" just landed.",
            summary != null ? "\n" + summary + "\n" : "",
            "Open your dashboard to review the full recommendation set and keep your streak alive.",
            "",
            "Your coaching team"));
  }

  private Content streakNudge(NotificationPayload payload) {
    String name = normalizeName(payload.recipient().displayName());
    String label = STREAK_LABELS.getOrDefault(orEmpty(payload.dataText("streakType")), "daily");
    String streak = orEmpty(payload.dataText("currentStreak"));
    return new Content(
        "Keep your " + label + " streak going!",
        html(
            "<p>Hi " + escape(name) + ",</p>",
            "<p>You're on a <strong>" + escape(streak) + "-day</strong> " + label +
                " streak. One more action today keeps the momentum going.</p>",
            "<p>Jump back in now to stay on track.</p>",
            "<p>Your coaching team</p>"),
        text(
            "Hi " + name + ",",
            "",
            "You're on a " + streak + "-day " + label + " streak. One more action today keeps the momentum going.",
            "",
            "Jump back in now to stay on track.",
            "",
            "Your coaching team"));
  }

  private Content moderationNotice(NotificationPayload payload) {
    String name = normalizeName(payload.recipient().displayName());
    String flagId = orEmpty(payload.dataText("flagId"));
    String status = orEmpty(payload.dataText("status"));
    String reason = payload.dataText("reason");
    return new Content(
        "Moderation update on your community activity",
        html(
            "<p>Hi " + escape(name) + ",</p>",
            "<p>We reviewed flag " + escape(flagId) + " and marked it as <strong>" + escape(status) + "</strong>.</p>",
            reason != null ? "<p>" + escape(reason) + "</p>" : "",
            "<p>Reach out in-app if something looks off.</p>",
            "<p>Community moderation</p>"),
        text(
            "Hi " + name + ",",
            "",
            "We reviewed flag " + flagId + " and marked it as " + status + ".",
            reason != null ? "\n" + reason + "\n" : "",
            "Reach out in-app if something looks off.",
            "",
            "Community moderation"));
  }

  private Content onboardingWelcome(NotificationPayload payload) {
    String name = normalizeName(payload.recipient().displayName());
    String loginUrl = orDefault(payload.dataText("loginUrl"), DEFAULT_LOGIN_URL);
    String supportEmail = orDefault(payload.dataText("supportEmail"), DEFAULT_SUPPORT_EMAIL);
    return new Content(
        "Welcome aboard!",
        html(
            "<p>Hi " + escape(name) + ",</p>",
            "<p>Welcome aboard! Your dashboard is ready whenever you are.</p>",
            "<p><a href=\"" + escape(loginUrl) + "\">Sign in</a> to complete onboarding, " +
                "or reply to this email for help.</p>",
            "<p>If you get stuck, reach us at <a href=\"mailto:" + escape(supportEmail) + "\">" +
                escape(supportEmail) + "</a>.</p>",
            "<p>Your coaching team</p>"),
        text(
            "Hi " + name + ",",
            "",
            "Welcome aboard! Your dashboard is ready whenever you are.",
            "Sign in at " + loginUrl + " to complete onboarding, or reply to this email for help.",
            "If you get stuck, reach us at " + supportEmail + ".",
            "",
            "Your coaching team"));
  }

  private Content communityEvent(NotificationPayload payload) {
    String name = normalizeName(payload.recipient().displayName());
    String eventName = orEmpty(payload.dataText("eventName"));
    String ctaUrl = orDefault(payload.dataText("ctaUrl"), DEFAULT_COMMUNITY_URL);
    String startLine = startLine(payload.dataText("eventStartsAt"));
    return new Content(
        eventName + " kicks off soon!",
        html(
            "<p>Hi " + escape(name) + ",</p>",
            "<p>" + escape(eventName) + " is coming up. " + escape(startLine) + "</p>",
            "<p><a href=\"" + escape(ctaUrl) + "\">Save your spot now</a> so you don't miss the opening.</p>",
            "<p>The community team</p>"),
        text(
            "Hi " + name + ",",
            "",
            eventName + " is coming up. " + startLine,
            "Save your spot now at " + ctaUrl + " so you don't miss the opening.",
            "",
            "The community team"));
  }

  private String startLine(String startsAt) {
    if (startsAt == null) {
      return "It kicks off soon.";
    }
    try {
      Instant start = OffsetDateTime.parse(startsAt).toInstant();
      return "It kicks off on " + eventTimeFormat.format(start) + ".";
    } catch (DateTimeParseException e) {
      return "It kicks off soon.";
    }
  }

  private static String html(String... parts) {
    return String.join("", parts);
  }

  private static String text(String... lines) {
    return String.join("\n", lines);
  }

  private static String orEmpty(String value) {
    return value == null ? "" : value;
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }

  static String escape(String value) {
    StringBuilder out = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '&' -> out.append("&amp;");
        case '<' -> out.append("&lt;");
        case '>' -> out.append("&gt;");
        case '"' -> out.append("&quot;");
        case '\'' -> out.append("&#39;");
        default -> out.append(c);
      }
    }
    return out.toString();
  }

  private record Content(String subject, String html, String text) {
  }
}
