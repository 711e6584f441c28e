package com.scholary.livefeed.api;

import com.scholary.livefeed.source.MediaLibrary;
import com.scholary.livefeed.source.MediaLibrary.MediaFile;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/media")
@Tag(name = "Media", description = "Local video library for looped-file streams")
public class MediaController {

  private final MediaLibrary mediaLibrary;

  public MediaController(MediaLibrary mediaLibrary) {
    this.mediaLibrary = mediaLibrary;
  }

  @GetMapping
  @Operation(summary = "List video files available as looped sources")
  public List<MediaFile> list() throws IOException {
    return mediaLibrary.scan();
  }
}
