/**
Package that contains gzip specific parts: envelope format helpers,
{@link java.util.zip.Deflater} based compression engine (and recycler
for deflater instances), and a compressing {@link java.io.InputStream}.
Internally JDK provided efficient ZLIB codec is used for actual encoding.
*/

package com.ning.deflate.gzip;
