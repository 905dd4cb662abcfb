package com.github.dimitryivaniuta.content.publishing.web;

import com.github.dimitryivaniuta.content.publishing.service.PostLifecycleService;
import com.github.dimitryivaniuta.content.publishing.service.PostService;
import com.github.dimitryivaniuta.content.publishing.service.dto.AllowedTransitions;
import com.github.dimitryivaniuta.content.publishing.service.dto.PostView;
import com.github.dimitryivaniuta.content.publishing.service.scheduler.PublishNowService;
import com.github.dimitryivaniuta.content.publishing.web.dto.ApproveRequest;
import com.github.dimitryivaniuta.content.publishing.web.dto.ArchiveRequest;
import com.github.dimitryivaniuta.content.publishing.web.dto.CreatePostRequest;
import com.github.dimitryivaniuta.content.publishing.web.dto.EditRequest;
import com.github.dimitryivaniuta.content.publishing.web.dto.PublishNowRequest;
import com.github.dimitryivaniuta.content.publishing.web.dto.RejectRequest;
import com.github.dimitryivaniuta.content.publishing.web.dto.ScheduleRequest;
import jakarta.validation.Valid;
import java.net.URI;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for post lifecycle commands.
 *
 * <p>Every command maps to one lifecycle event; refused events answer 400 with the events the
 * post currently accepts. Optional bodies may be omitted entirely.</p>
 */
@RestController
@RequestMapping(value = "/api/posts", produces = MediaType.APPLICATION_JSON_VALUE)
public class PostsController {

    private final PostService postService;
    private final PostLifecycleService lifecycleService;
    private final PublishNowService publishNowService;

    public PostsController(PostService postService, PostLifecycleService lifecycleService, PublishNowService publishNowService) {
        this.postService = postService;
        this.lifecycleService = lifecycleService;
        this.publishNowService = publishNowService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PostView> create(@Valid @RequestBody CreatePostRequest request) {
        PostView created = postService.createDraft(request.platform(), request.content());
        return ResponseEntity.created(URI.create("/api/posts/" + created.id())).body(created);
    }

    @GetMapping("/{postId}")
    public PostView get(@PathVariable String postId) {
        return postService.getPost(postId);
    }

    @GetMapping("/{postId}/transitions")
    public AllowedTransitions transitions(@PathVariable String postId) {
        return postService.allowedTransitions(postId);
    }

    @PostMapping("/{postId}/submit")
    public PostView submit(@PathVariable String postId) {
        return PostView.from(lifecycleService.submitForReview(postId));
    }

    @PostMapping("/{postId}/approve")
    public PostView approve(@PathVariable String postId, @Valid @RequestBody(required = false) ApproveRequest request) {
        return PostView.from(lifecycleService.approve(postId, request == null ? null : request.approvedBy()));
    }

    @PostMapping("/{postId}/reject")
    public PostView reject(@PathVariable String postId, @Valid @RequestBody(required = false) RejectRequest request) {
        String rejectedBy = request == null ? null : request.rejectedBy();
        String reason = request == null ? null : request.reason();
        return PostView.from(lifecycleService.reject(postId, rejectedBy, reason));
    }

    @PostMapping(value = "/{postId}/schedule", consumes = MediaType.APPLICATION_JSON_VALUE)
    public PostView schedule(@PathVariable String postId, @Valid @RequestBody ScheduleRequest request) {
        return PostView.from(lifecycleService.schedule(postId, request.scheduledTime(), request.platform()));
    }

    /**
     * Publishes an approved post immediately, in this request.
     *
     * @param postId post id
     * @param request optional platform override
     * @return post after the attempt, PUBLISHED or FAILED
     */
    @PostMapping("/{postId}/publish-now")
    public PostView publishNow(@PathVariable String postId, @Valid @RequestBody(required = false) PublishNowRequest request) {
        return PostView.from(publishNowService.publishNow(postId, request == null ? null : request.platform()));
    }

    @PostMapping("/{postId}/unschedule")
    public PostView unschedule(@PathVariable String postId) {
        return PostView.from(lifecycleService.unschedule(postId));
    }

    @PostMapping("/{postId}/retry")
    public PostView retry(@PathVariable String postId) {
        return PostView.from(lifecycleService.retry(postId));
    }

    @PostMapping("/{postId}/archive")
    public PostView archive(@PathVariable String postId, @Valid @RequestBody(required = false) ArchiveRequest request) {
        return PostView.from(lifecycleService.archive(postId, request == null ? null : request.reason()));
    }

    @PostMapping("/{postId}/edit")
    public PostView edit(@PathVariable String postId, @Valid @RequestBody(required = false) EditRequest request) {
        return PostView.from(lifecycleService.edit(postId, request == null ? null : request.content()));
    }

    /**
     * Hard-deletes a post.
     *
     * @param postId post id
     * @return last snapshot, status DELETED
     */
    @DeleteMapping("/{postId}")
    public PostView delete(@PathVariable String postId) {
        return PostView.from(lifecycleService.delete(postId));
    }
}
