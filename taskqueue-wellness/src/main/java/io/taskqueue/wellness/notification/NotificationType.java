package io.taskqueue.wellness.notification;

public enum NotificationType {
  INSIGHT_ALERT,
  STREAK_NUDGE,
  MODERATION_NOTICE,
  ONBOARDING_WELCOME,
  COMMUNITY_EVENT
}
