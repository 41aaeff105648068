package io.taskqueue.wellness.notification;

import java.util.List;
import java.util.Objects;

/**
 * A rendered email ready for an {@link EmailSender}.
 *
 * @param tags delivery-provider tags used for analytics
 */
public record EmailMessage(String to, String subject, String html, String text, List<Tag> tags) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(html, "html");
    Objects.requireNonNull(text, "text");
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public record Tag(String name, String value) {
  }
}
