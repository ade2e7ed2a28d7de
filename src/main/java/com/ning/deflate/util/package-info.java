/**
Package that contains helper classes that can be used along
with {@link com.ning.deflate.CompressingChannel}.
*/

package com.ning.deflate.util;
