package com.codeops.lineage.service;

import com.codeops.lineage.dto.mapper.TagMapper;
import com.codeops.lineage.dto.request.CreateTagRequest;
import com.codeops.lineage.dto.response.TagResponse;
import com.codeops.lineage.entity.ActivityModule;
import com.codeops.lineage.entity.Commit;
import com.codeops.lineage.entity.Tag;
import com.codeops.lineage.entity.enums.TagType;
import com.codeops.lineage.exception.NotFoundException;
import com.codeops.lineage.exception.ValidationException;
import com.codeops.lineage.repository.TagRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.UUID;

/**
 * Service for named tags on commits. Tag names are unique within a lineage.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
@Validated
public class TagService {

    private final TagRepository tagRepository;
    private final ModuleService moduleService;
    private final CommitService commitService;
    private final TagMapper tagMapper;

    /**
     * Tags a commit in the lineage of a module.
     *
     * @param moduleId any module of the lineage
     * @param actorId  the user creating the tag
     * @param request  tag name, commit hash, description and type
     * @return the created tag
     * @throws NotFoundException   if the module or commit does not exist
     * @throws ValidationException if the lineage already has a tag with the name
     */
    public TagResponse createTag(@NotNull UUID moduleId, @NotNull UUID actorId, @Valid CreateTagRequest request) {
        ActivityModule module = moduleService.findModule(moduleId);
        UUID lineageId = module.lineageId();
        if (tagRepository.existsByNameAndLineageId(request.name(), lineageId)) {
            throw new ValidationException("Tag '" + request.name() + "' already exists in this lineage");
        }
        Commit commit = commitService.findCommitByHash(request.commitHash());

        Tag tag = Tag.builder()
                .name(request.name())
                .description(request.description())
                .commit(commit)
                .lineageId(lineageId)
                .tagType(request.tagType() != null ? request.tagType() : TagType.SNAPSHOT)
                .createdBy(actorId)
                .build();
        Tag saved = tagRepository.save(tag);
        log.info("Tagged commit {} as '{}' in lineage {}", commit.getHash(), saved.getName(), lineageId);
        return tagMapper.toResponse(saved);
    }

    /**
     * Lists the tags of a module's lineage, newest first.
     */
    @Transactional(readOnly = true)
    public List<TagResponse> listTags(@NotNull UUID moduleId) {
        ActivityModule module = moduleService.findModule(moduleId);
        return tagMapper.toResponseList(tagRepository.findByLineageIdOrderByCreatedAtDesc(module.lineageId()));
    }

    @Transactional(readOnly = true)
    public TagResponse getTag(@NotNull UUID moduleId, @NotBlank String name) {
        ActivityModule module = moduleService.findModule(moduleId);
        return tagRepository.findByNameAndLineageId(name, module.lineageId())
                .map(tagMapper::toResponse)
                .orElseThrow(() -> new NotFoundException("Tag not found: " + name));
    }

    public TagResponse deleteTag(@NotNull UUID tagId) {
        Tag tag = tagRepository.findById(tagId)
                .orElseThrow(() -> new NotFoundException("Tag not found: " + tagId));
        TagResponse response = tagMapper.toResponse(tag);
        tagRepository.delete(tag);
        log.info("Deleted tag '{}'", tag.getName());
        return response;
    }
}
