package com.zzf.coder.controller;

import com.zzf.coder.core.context.Turn;
import com.zzf.coder.session.SessionOptions;
import com.zzf.coder.session.SessionService;
import com.zzf.coder.session.SessionView;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionService sessionService;

    @Data
    public static class StartRequest {
        private String instruction;
        private String projectRoot;
        private SessionOptions options;
    }

    @Data
    public static class ResumeRequest {
        private String projectRoot;
        private SessionOptions options;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SessionView start(@RequestBody StartRequest request) {
        return SessionView.of(sessionService.start(request.getInstruction(), request.getProjectRoot(), request.getOptions()));
    }

    @GetMapping
    public List<SessionView> list() {
        return sessionService.list();
    }

    @GetMapping("/{id}")
    public SessionView status(@PathVariable("id") String id) {
        return sessionService.status(id);
    }

    @GetMapping("/{id}/turns")
    public List<Turn> turns(@PathVariable("id") String id) {
        return sessionService.turns(id);
    }

    @PostMapping("/{id}/cancel")
    public SessionView cancel(@PathVariable("id") String id) {
        return sessionService.cancel(id);
    }

    @PostMapping("/{id}/resume")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SessionView resume(@PathVariable("id") String id, @RequestBody ResumeRequest request) {
        return SessionView.of(sessionService.resume(id, request.getProjectRoot(), request.getOptions()));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void remove(@PathVariable("id") String id) {
        sessionService.remove(id);
    }
}
