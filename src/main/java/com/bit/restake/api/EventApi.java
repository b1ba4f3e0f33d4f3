package com.bit.restake.api;

import com.bit.restake.event.EventRecorder;
import com.bit.restake.result.Result;
import com.bit.restake.structure.event.RestakeEvent;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/event")
public class EventApi {

    @Autowired
    private EventRecorder eventRecorder;

    // 最近事件，序号倒序
    @GetMapping("/recent")
    public Result<List<RestakeEvent>> recent(@RequestParam(defaultValue = "50") int limit) {
        return Result.OK(eventRecorder.recent(Math.max(1, Math.min(limit, 1000))));
    }

    @GetMapping("/count")
    public Result<Long> count() {
        return Result.OK(eventRecorder.count());
    }
}
