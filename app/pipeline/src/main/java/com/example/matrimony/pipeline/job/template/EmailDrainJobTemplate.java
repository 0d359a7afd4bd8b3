package com.example.matrimony.pipeline.job.template;

import com.example.matrimony.pipeline.delivery.NotificationDeliveryService;
import com.example.matrimony.pipeline.model.NotificationChannel;
import org.springframework.stereotype.Component;

@Component
public class EmailDrainJobTemplate extends ChannelDrainJobTemplate {

  public static final String TYPE = "email_drain";

  public EmailDrainJobTemplate(NotificationDeliveryService deliveryService) {
    super(deliveryService, NotificationChannel.EMAIL, 100, 500, "testEmail");
  }

  @Override
  public String type() {
    return TYPE;
  }
}
