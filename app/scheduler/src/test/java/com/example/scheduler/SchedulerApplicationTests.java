package com.example.scheduler;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.scheduler.channel.ChannelAdapter;
import com.example.scheduler.channel.LocalChannelAdapter;
import com.example.scheduler.dispatch.DispatchWorker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class SchedulerApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private ApplicationContext context;

  @Test
  void contextLoads() {
    // test プロファイルでは定期発火を止め、ローカル配信だけを使う
    assertThat(context.getBeansOfType(DispatchWorker.class)).isEmpty();
    assertThat(context.getBean(ChannelAdapter.class)).isInstanceOf(LocalChannelAdapter.class);
  }
}
