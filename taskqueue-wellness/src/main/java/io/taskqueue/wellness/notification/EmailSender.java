package io.taskqueue.wellness.notification;

/**
 * Transactional email delivery.
 */
public interface EmailSender {

  void send(EmailMessage message) throws Exception;
}
