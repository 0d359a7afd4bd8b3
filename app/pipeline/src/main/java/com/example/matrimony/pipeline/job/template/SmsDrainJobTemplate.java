package com.example.matrimony.pipeline.job.template;

import com.example.matrimony.pipeline.delivery.NotificationDeliveryService;
import com.example.matrimony.pipeline.model.NotificationChannel;
import org.springframework.stereotype.Component;

@Component
public class SmsDrainJobTemplate extends ChannelDrainJobTemplate {

  public static final String TYPE = "sms_drain";

  public SmsDrainJobTemplate(NotificationDeliveryService deliveryService) {
    super(deliveryService, NotificationChannel.SMS, 50, 100, "testPhone");
  }

  @Override
  public String type() {
    return TYPE;
  }
}
