package com.example.matrimony.pipeline.job.template;

import com.example.matrimony.pipeline.delivery.NotificationDeliveryService;
import com.example.matrimony.pipeline.model.NotificationChannel;
import org.springframework.stereotype.Component;

@Component
public class PushDrainJobTemplate extends ChannelDrainJobTemplate {

  public static final String TYPE = "push_drain";

  public PushDrainJobTemplate(NotificationDeliveryService deliveryService) {
    super(deliveryService, NotificationChannel.PUSH, 100, 500, null);
  }

  @Override
  public String type() {
    return TYPE;
  }
}
