package com.prestige.store.notification;

import com.prestige.store.data.Row;
import java.util.Locale;
import org.springframework.lang.Nullable;

/** 管理者・顧客向け WhatsApp 本文の組み立て。 */
public final class NotificationMessages {

  private static final String NOT_SPECIFIED = "Not specified";

  private NotificationMessages() {}

  public static String inquiry(Row inquiry, @Nullable Row watch) {
    final StringBuilder message = new StringBuilder("🔔 New Watch Inquiry\n\n");
    if (watch != null) {
      message
          .append("Watch: ")
          .append(watch.getString("brand"))
          .append(' ')
          .append(watch.getString("model"))
          .append('\n')
          .append("Reference: ")
          .append(watch.getString("reference"))
          .append('\n')
          .append("Price: ")
          .append(formatAmount(watch.getLong("price")))
          .append("\n\n");
    } else {
      message.append("Watch: General inquiry\n\n");
    }
    message
        .append("Customer: ")
        .append(inquiry.getString("customer_name"))
        .append('\n')
        .append("Email: ")
        .append(inquiry.getString("customer_email"))
        .append('\n')
        .append("Phone: ")
        .append(orDefault(inquiry.getString("customer_phone"), "Not provided"))
        .append("\n\n")
        .append("Message: ")
        .append(orDefault(inquiry.getString("message"), ""))
        .append("\n\n")
        .append("Reply to this customer promptly! 💼");
    return message.toString();
  }

  public static String sellSubmission(Row submission) {
    final StringBuilder message =
        new StringBuilder("💰 New Sell Submission\n\n")
            .append("Watch Details:\n")
            .append("• Brand: ")
            .append(submission.getString("brand"))
            .append('\n')
            .append("• Model: ")
            .append(submission.getString("model"))
            .append('\n')
            .append("• Reference: ")
            .append(orDefault(submission.getString("reference"), NOT_SPECIFIED))
            .append('\n')
            .append("• Year: ")
            .append(orDefault(submission.getString("production_year"), NOT_SPECIFIED))
            .append('\n')
            .append("• Condition: ")
            .append(submission.getString("condition"))
            .append('\n')
            .append("• Accessories: ")
            .append(orDefault(submission.getString("accessories"), NOT_SPECIFIED))
            .append("\n\n")
            .append("Customer: ")
            .append(submission.getString("customer_name"))
            .append('\n')
            .append("Email: ")
            .append(submission.getString("customer_email"))
            .append('\n')
            .append("Phone: ")
            .append(submission.getString("customer_phone"))
            .append("\n\n");
    final String description = submission.getString("description");
    if (hasText(description)) {
      message.append("Description: ").append(description).append("\n\n");
    }
    return message.append("Provide quote and contact customer! 📞").toString();
  }

  public static String quote(Row submission, long quote, @Nullable String notes) {
    final StringBuilder message =
        new StringBuilder("💵 Quote Ready for ")
            .append(submission.getString("customer_name"))
            .append("\n\n")
            .append("Watch: ")
            .append(submission.getString("brand"))
            .append(' ')
            .append(submission.getString("model"))
            .append('\n')
            .append("Our Offer: ")
            .append(formatAmount(quote))
            .append("\n\n");
    if (hasText(notes)) {
      message.append("Notes: ").append(notes).append("\n\n");
    }
    return message
        .append("Customer Contact:\n")
        .append("📧 ")
        .append(submission.getString("customer_email"))
        .append('\n')
        .append("📱 ")
        .append(submission.getString("customer_phone"))
        .append("\n\n")
        .append("Follow up with the customer! 📞")
        .toString();
  }

  public static String watch(Row watch) {
    final StringBuilder message =
        new StringBuilder("⌚ ")
            .append(watch.getString("brand"))
            .append(' ')
            .append(watch.getString("model"))
            .append("\n\n")
            .append("📋 Reference: ")
            .append(watch.getString("reference"))
            .append('\n')
            .append("📅 Year: ")
            .append(orDefault(watch.getString("production_year"), "N/A"))
            .append('\n')
            .append("🏆 Condition: ")
            .append(watch.getString("condition"))
            .append('\n')
            .append("💰 Price: ")
            .append(formatAmount(watch.getLong("price")))
            .append("\n\n");
    if (hasText(watch.getString("description"))) {
      message.append(watch.getString("description")).append("\n\n");
    }
    if (hasText(watch.getString("accessories"))) {
      message.append("📦 Includes: ").append(watch.getString("accessories")).append('\n');
    }
    return message.append("Interested? Reply to this message or call us! 📞").toString();
  }

  public static String inquiryResponse(String customerName, @Nullable Row watch) {
    final StringBuilder message =
        new StringBuilder("Hi ")
            .append(customerName)
            .append("! 👋\n\n")
            .append("Thank you for your inquiry about our luxury timepieces. ");
    if (watch != null) {
      message
          .append("I see you're interested in the ")
          .append(watch.getString("brand"))
          .append(' ')
          .append(watch.getString("model"))
          .append(". ");
    }
    return message
        .append("Our team of watch experts will review your request and respond within 24 hours")
        .append(" with detailed information and pricing.\n\n")
        .append("For immediate assistance:\n")
        .append("📞 Call: +1-234-567-8900\n")
        .append("📧 Email: info@prestigetimepieces.com\n")
        .append("🌐 Visit: www.prestigetimepieces.com\n\n")
        .append("Thank you for choosing Prestige Timepieces! 🏆")
        .toString();
  }

  static String formatAmount(@Nullable Long amount) {
    if (amount == null) {
      return "N/A";
    }
    return String.format(Locale.US, "%,d", amount);
  }

  private static String orDefault(@Nullable String value, String fallback) {
    return hasText(value) ? value : fallback;
  }

  private static boolean hasText(@Nullable String value) {
    return value != null && !value.isBlank();
  }
}
